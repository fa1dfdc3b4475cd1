package cli;

import app.NlSqlCliApp;

/**
 * CLI entrypoint facade.
 *
 * <p>Option parsing, orchestration and reporting live in {@link NlSqlCliApp}.</p>
 */
public class NlSqlCli {

    public static void main(String[] args) {
        NlSqlCliApp.main(args);
    }
}
