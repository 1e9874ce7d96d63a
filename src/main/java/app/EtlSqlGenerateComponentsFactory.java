package app;

import cli.CliPathResolver;
import domain.generate.EtlSqlGenerator;
import domain.generate.GenerationOptions;
import domain.mapping.MappingLoadResult;
import domain.output.ResultWriter;
import domain.output.SqlOutputWriter;
import infra.mapping.MappingCsvLoader;
import infra.mapping.MappingJsonLoader;
import infra.output.FileSqlOutputWriter;
import infra.output.NullResultWriter;
import infra.output.NullSqlOutputWriter;
import infra.output.XlsxResultWriter;

import java.nio.file.Path;

/**
 * Object-assembly factory for {@link EtlSqlGenerateCliApp}.
 * <p>
 * Goal: keep the CLI app focused on orchestration/logging and move object
 * creation ("new") and initialization concerns here.
 */
final class EtlSqlGenerateComponentsFactory {

    private final MappingJsonLoader jsonLoader = new MappingJsonLoader();

    /** CSV sheets are loaded as-is; JSON goes through the repair-aware loader. */
    MappingLoadResult loadMapping(Path mappingPath, boolean repairEnabled) {
        if (CliPathResolver.isCsv(mappingPath)) {
            return MappingLoadResult.clean(new MappingCsvLoader().load(mappingPath));
        }
        return jsonLoader.load(mappingPath, repairEnabled);
    }

    EtlSqlGenerator createGenerator(GenerationOptions options) {
        return new EtlSqlGenerator(jsonLoader, options);
    }

    SqlOutputWriter createSqlOutputWriter(boolean enable) {
        if (!enable) return new NullSqlOutputWriter();
        return new FileSqlOutputWriter();
    }

    ResultWriter createResultWriter(boolean enable) {
        if (!enable) return new NullResultWriter();
        return new XlsxResultWriter();
    }
}
