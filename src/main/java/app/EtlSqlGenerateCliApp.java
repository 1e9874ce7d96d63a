package app;

import cli.CliArgParser;
import cli.CliPathResolver;
import cli.EtlSqlGenerateCli;
import domain.generate.EtlSqlGenerator;
import domain.generate.GenerationOptions;
import domain.generate.UnknownTierPolicy;
import domain.mapping.MalformedMappingException;
import domain.mapping.MappingLoadResult;
import domain.model.GenerationResult;
import domain.model.GenerationSummary;
import domain.model.GenerationWarning;
import domain.output.ResultWriter;
import domain.output.SqlOutputWriter;

import java.nio.file.Path;
import java.util.Map;

/** CLI entry (invoked by {@link EtlSqlGenerateCli}). */
public final class EtlSqlGenerateCliApp {

    public static final int EXIT_OK = 0;
    public static final int EXIT_FAILED = 1;
    public static final int EXIT_REVIEW_REQUIRED = 2;

    private static final String DEFAULT_OUT = "output/etl.sql";
    private static final String DEFAULT_RESULT = "output/etl-result.xlsx";

    private EtlSqlGenerateCliApp() {}

    public static void main(String[] args) {
        int code = run(args);
        if (code != EXIT_OK) System.exit(code);
    }

    /** @return process exit code */
    public static int run(String[] args) {

        long t0 = System.nanoTime();
        Map<String, String> argv = CliArgParser.parseArgs(args);

        CliPathResolver.applyBaseDirPropertyIfPresent(argv);
        Path baseDir = CliPathResolver.resolveBaseDir();

        // ------------------------------------------------------------
        // input / output
        // ------------------------------------------------------------
        Path mappingPath = CliPathResolver.resolvePath(baseDir, CliArgParser.option(argv, "mapping"));
        Path outSql = CliPathResolver.resolvePath(baseDir, CliArgParser.option(argv, "out", DEFAULT_OUT));
        Path splitDir = CliPathResolver.resolvePath(baseDir, CliArgParser.option(argv, "splitDir"));
        Path resultXlsx = CliPathResolver.resolvePath(baseDir, CliArgParser.option(argv, "result", DEFAULT_RESULT));

        // ------------------------------------------------------------
        // feature toggles (presence-style)
        // ------------------------------------------------------------
        boolean noSqlOut = CliArgParser.flag(argv, "noSqlOut");
        boolean noResult = CliArgParser.flag(argv, "noResult");
        boolean failOnReview = CliArgParser.flag(argv, "failOnReview");

        GenerationOptions options = GenerationOptions.builder()
                .idempotent(CliArgParser.flag(argv, "idempotent"))
                .repairEnabled(!CliArgParser.flag(argv, "noRepair"))
                .unknownTierPolicy(UnknownTierPolicy.parse(CliArgParser.option(argv, "unknownTier")))
                .defaultLiteral(CliArgParser.option(argv, "defaultLiteral"))
                .unionOriginLiteral(CliArgParser.option(argv, "unionLiteral"))
                .ratioCodes(CliArgParser.option(argv, "ratioNumerator"), CliArgParser.option(argv, "ratioDenominator"))
                .build();

        System.out.println("==================================================");
        System.out.println("[START] ETL SQL generation");
        System.out.println("[CONF] baseDir        = " + baseDir);
        System.out.println("[CONF] mapping        = " + (mappingPath == null ? "" : mappingPath));
        System.out.println("[CONF] out            = " + outSql);
        System.out.println("[CONF] splitDir       = " + (splitDir == null ? "(off)" : splitDir));
        System.out.println("[CONF] result         = " + resultXlsx);
        System.out.println("[CONF] options        = " + options);
        System.out.println("[CONF] enableSqlOut   = " + (!noSqlOut) + " (use --noSqlOut)");
        System.out.println("[CONF] enableResult   = " + (!noResult) + " (use --noResult)");
        System.out.println("[CONF] failOnReview   = " + failOnReview);
        System.out.println("==================================================");

        EtlSqlGenerateComponentsFactory factory = new EtlSqlGenerateComponentsFactory();
        GenerationResult result;
        try {
            CliPathResolver.validateFileExists(mappingPath, "mapping file (--mapping)");

            long tLoad0 = System.nanoTime();
            MappingLoadResult loaded = factory.loadMapping(mappingPath, options.isRepairEnabled());
            System.out.println("[STEP1] mapping loaded. tables=" + loaded.getDocument().size()
                    + ", repaired=" + loaded.isRepaired() + ", elapsed=" + ms(tLoad0) + "ms");

            long tGen0 = System.nanoTime();
            EtlSqlGenerator generator = factory.createGenerator(options);
            result = generator.generate(loaded);
            System.out.println("[STEP2] sql generated. statements=" + result.getStatements().size()
                    + ", elapsed=" + ms(tGen0) + "ms");

            // disabled outputs get the no-op writers
            SqlOutputWriter sqlOutputWriter = factory.createSqlOutputWriter(!noSqlOut);
            long tOut0 = System.nanoTime();
            sqlOutputWriter.write(outSql, splitDir, result);
            System.out.println(noSqlOut
                    ? "[STEP3] sql output skipped (--noSqlOut)."
                    : "[STEP3] sql written. elapsed=" + ms(tOut0) + "ms");

            ResultWriter resultWriter = factory.createResultWriter(!noResult);
            long tXlsx0 = System.nanoTime();
            resultWriter.write(resultXlsx, result);
            System.out.println(noResult
                    ? "[STEP4] result xlsx skipped (--noResult)."
                    : "[STEP4] result xlsx written. elapsed=" + ms(tXlsx0) + "ms");

        } catch (MalformedMappingException e) {
            System.out.println("[ERROR] malformed mapping: " + safe(e.getMessage()));
            return EXIT_FAILED;
        } catch (RuntimeException e) {
            System.out.println("[ERROR] generation failed");
            System.out.println("        ex=" + e.getClass().getName() + ": " + safe(e.getMessage()));
            e.printStackTrace(System.out);
            return EXIT_FAILED;
        }

        for (GenerationWarning w : result.getWarnings()) {
            System.out.println("[WARN] " + w);
        }

        GenerationSummary summary = result.getSummary();
        System.out.println("[STAT] " + summary);
        System.out.println("==================================================");
        System.out.println("[DONE] requiresReview=" + summary.requiresReview() + ", totalElapsed=" + ms(t0) + "ms");
        System.out.println("==================================================");

        if (failOnReview && summary.requiresReview()) {
            System.out.println("[WARN] review required (--failOnReview)");
            return EXIT_REVIEW_REQUIRED;
        }
        return EXIT_OK;
    }

    private static long ms(long nanoStart) {
        return (System.nanoTime() - nanoStart) / 1_000_000L;
    }

    private static String safe(String s) {
        return (s == null) ? "" : s;
    }
}
