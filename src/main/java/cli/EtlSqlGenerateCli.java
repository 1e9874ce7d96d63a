package cli;

import app.EtlSqlGenerateCliApp;

/**
 * CLI entrypoint facade.
 *
 * <p>Orchestration and logging live in {@link EtlSqlGenerateCliApp} so they can be tested
 * without a process exit.</p>
 */
public class EtlSqlGenerateCli {

    public static void main(String[] args) {
        int code = EtlSqlGenerateCliApp.run(args);
        if (code != 0) System.exit(code);
    }
}
