package app;

import cli.CliArgParser;
import cli.CliPathResolver;
import cli.CliProgressMonitor;
import cli.NlSqlCli;
import domain.convert.NlSqlTranslator;
import domain.model.BatchResultRow;
import domain.model.ListTranslationWarningSink;
import domain.model.NlQuery;
import domain.model.TokenView;
import domain.model.TranslationMethod;
import domain.model.TranslationResult;
import domain.model.TranslationWarning;
import domain.model.TranslationWarningSink;
import domain.model.WarningCode;
import domain.output.ResultWriter;
import domain.output.SqlOutputWriter;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/** CLI entry (invoked by {@link NlSqlCli}). */
public final class NlSqlCliApp {

    static final String PROP_FALLBACK = "nlsql.fallback";

    static final int EXIT_OK = 0;
    static final int EXIT_STOPPED = 1;
    static final int EXIT_USAGE = 2;

    private NlSqlCliApp() {}

    public static void main(String[] args) {
        int code = run(args);
        if (code != EXIT_OK) System.exit(code);
    }

    static int run(String[] args) {
        long t0 = System.nanoTime();
        Map<String, String> argv = CliArgParser.parseArgs(args);

        CliPathResolver.applyBaseDirPropertyIfPresent(argv);
        Path baseDir = CliPathResolver.resolveBaseDir();

        boolean noFallback = CliArgParser.flag(argv, "noFallback")
                || !CliArgParser.parseBoolean(CliArgParser.option(argv, "fallback", PROP_FALLBACK, "true"), true);

        NlSqlComponentsFactory factory = new NlSqlComponentsFactory();
        NlSqlTranslator translator = factory.createTranslator(!noFallback);

        String query = argv.get("query");
        if (query != null && !query.isBlank()) {
            return runSingle(translator, query);
        }

        String input = argv.get("input");
        if (input == null || input.isBlank()) {
            printUsage();
            return EXIT_USAGE;
        }

        Path inputPath = CliPathResolver.resolvePath(baseDir, input);
        Path outputSqlDir = CliPathResolver.resolvePath(baseDir, argv.getOrDefault("out", "output/sql"));
        Path resultXlsx = CliPathResolver.resolvePath(baseDir, argv.getOrDefault("result", "output/nl-sql-result.xlsx"));

        int max = CliArgParser.parseInt(argv.get("max"), -1);
        int logEvery = Math.max(1, CliArgParser.parseInt(argv.get("logEvery"), 100));
        long slowMs = CliArgParser.parseLong(argv.get("slowMs"), 200L);
        boolean failFast = CliArgParser.flag(argv, "failFast");
        boolean logFallback = CliArgParser.flag(argv, "logFallback");
        boolean noSqlOut = CliArgParser.flag(argv, "noSqlOut");
        boolean noResult = CliArgParser.flag(argv, "noResult");

        System.out.println("==================================================");
        System.out.println("[START] NL to SQL batch translation");
        System.out.println("[CONF] baseDir        = " + baseDir);
        System.out.println("[CONF] input          = " + inputPath);
        System.out.println("[CONF] out            = " + outputSqlDir);
        System.out.println("[CONF] result         = " + resultXlsx);
        System.out.println("[CONF] max            = " + max);
        System.out.println("[CONF] logEvery       = " + logEvery);
        System.out.println("[CONF] slowMs         = " + slowMs);
        System.out.println("[CONF] failFast       = " + failFast);
        System.out.println("[CONF] logFallback    = " + logFallback);
        System.out.println("[CONF] enableFallback = " + (!noFallback) + " (use --noFallback, --fallback=false or -D" + PROP_FALLBACK + "=false)");
        System.out.println("[CONF] enableSqlOut   = " + (!noSqlOut) + " (use --noSqlOut)");
        System.out.println("[CONF] enableResult   = " + (!noResult) + " (use --noResult)");
        System.out.println("==================================================");

        CliPathResolver.validateFileExists(inputPath, "query file (--input)");
        if (!noSqlOut) CliPathResolver.mkdirs(outputSqlDir);

        // ------------------------------------------------------------
        // load queries
        // ------------------------------------------------------------
        long tLoad0 = System.nanoTime();
        List<NlQuery> queries = factory.createQuerySource().load(inputPath.toString());
        System.out.println("[STEP1] queries loaded. size=" + queries.size() + ", elapsed=" + ms(tLoad0) + "ms");

        if (max > 0 && queries.size() > max) {
            queries = queries.subList(0, max);
            System.out.println("[STEP1] apply max => truncated to " + queries.size());
        }

        SqlOutputWriter sqlOutputWriter = factory.createSqlOutputWriter(!noSqlOut);
        ResultWriter resultWriter = factory.createResultWriter(!noResult);

        List<TranslationWarning> warnings = new ArrayList<>(128);
        TranslationWarningSink warningSink = new ListTranslationWarningSink(warnings);
        List<BatchResultRow> results = new ArrayList<>(Math.max(16, queries.size()));
        Tally counters = new Tally();
        boolean stopped = false;

        // ------------------------------------------------------------
        // translate
        // ------------------------------------------------------------
        long tLoop0 = System.nanoTime();
        int total = queries.size();
        CliProgressMonitor monitor = new CliProgressMonitor(total, logEvery);
        monitor.startHeartbeat();
        System.out.println("[STEP2] translating start. total=" + total);

        for (int i = 0; i < total; i++) {
            NlQuery q = queries.get(i);
            String id = q.getId();
            monitor.setCurrent(id, i + 1);

            long one0 = System.nanoTime();

            if (q.getText().isBlank()) {
                counters.skip++;
                results.add(BatchResultRow.skip(id, q.getText(), WarningCode.EMPTY_INPUT.name()));
                warningSink.warn(TranslationWarning.of(WarningCode.EMPTY_INPUT, id, q.getText(), "query text is empty"));
                monitor.progress(i + 1, counters.describe());
                continue;
            }

            try {
                TranslationResult r = translator.translate(q.getText(), id, warningSink);
                long oneMs = ms(one0);

                if (r.isSuccess()) {
                    if (r.getMethod() == TranslationMethod.LEGACY_DSL) {
                        counters.fallback++;
                        if (logFallback) System.out.println("[FALLBACK] " + id + " <= " + r.getDsl());
                    } else {
                        counters.success++;
                    }
                    sqlOutputWriter.write(outputSqlDir, id, q.getText(), r.getSql());
                    results.add(BatchResultRow.of(id, r, oneMs, ""));
                } else {
                    counters.failed++;
                    results.add(BatchResultRow.of(id, r, oneMs, r.getExplanation()));
                    System.out.println("[WARN] not translated: " + id + " : " + r.getSql());
                    if (failFast) {
                        System.out.println("[FAILFAST] stop on first untranslated query.");
                        stopped = true;
                        break;
                    }
                }

            } catch (RuntimeException e) {
                counters.skip++;
                results.add(BatchResultRow.skip(id, q.getText(), e.getClass().getSimpleName()));
                warningSink.warn(new TranslationWarning(
                        WarningCode.TRANSLATE_ERROR, id, q.getText(),
                        e.getClass().getSimpleName(), safe(e.getMessage())
                ));

                System.out.println("[ERROR] translate/write failed: " + id);
                System.out.println("        ex=" + e.getClass().getName() + ": " + safe(e.getMessage()));

                if (failFast) {
                    System.out.println("[FAILFAST] stop on first error.");
                    stopped = true;
                    break;
                }
            }

            long oneMs = ms(one0);
            if (oneMs >= slowMs) {
                System.out.println("[SLOW] " + oneMs + "ms : " + id);
                warningSink.warn(new TranslationWarning(
                        WarningCode.SLOW_QUERY, id, q.getText(),
                        "slowMs=" + slowMs + ", actualMs=" + oneMs, ""
                ));
            }

            monitor.progress(i + 1, counters.describe());
        }

        monitor.stopHeartbeat();
        System.out.println("[STEP2] translating done. elapsed=" + ms(tLoop0) + "ms");
        System.out.println("[STAT] " + counters.describe());
        System.out.println("[STAT] warnings=" + warnings.size());

        if (!noResult) {
            long tXlsx0 = System.nanoTime();
            System.out.println("[STEP3] writing result xlsx... rows=" + results.size());
            resultWriter.write(resultXlsx, results, warnings);
            System.out.println("[STEP3] result xlsx written. elapsed=" + ms(tXlsx0) + "ms");
        } else {
            System.out.println("[STEP3] result xlsx skipped (--noResult). rows=" + results.size());
        }

        System.out.println("==================================================");
        System.out.println("[DONE] totalElapsed=" + ms(t0) + "ms");
        System.out.println("==================================================");
        return stopped ? EXIT_STOPPED : EXIT_OK;
    }

    private static int runSingle(NlSqlTranslator translator, String query) {
        List<TranslationWarning> warnings = new ArrayList<>();
        TranslationResult r = translator.translate(query, "query", new ListTranslationWarningSink(warnings));

        System.out.println("[INPUT]  " + r.getInput());
        System.out.println("[METHOD] " + r.getMethod().getLabel());
        if (r.getTokens() != null) {
            System.out.println("[TOKENS] " + r.getTokens().stream()
                    .map(TokenView::toString)
                    .collect(Collectors.joining(" ")));
        }
        if (r.getDsl() != null) System.out.println("[DSL]    " + r.getDsl());
        System.out.println("[AST]    " + r.getAst());
        System.out.println("[SQL]    " + r.getSql());
        System.out.println("[INFO]   " + r.getExplanation());
        for (TranslationWarning w : warnings) {
            System.out.println("[WARN]   " + w);
        }
        return EXIT_OK;
    }

    private static void printUsage() {
        System.out.println("Usage:");
        System.out.println("  --query \"<text>\"             translate one query and print the stages");
        System.out.println("  --input <file.csv|file.txt>  batch mode (csv: id,query header; txt: one query per line)");
        System.out.println("  --out <dir>                  sql output dir (default output/sql), --noSqlOut to disable");
        System.out.println("  --result <file.xlsx>         report (default output/nl-sql-result.xlsx), --noResult to disable");
        System.out.println("  --noFallback --logFallback --failFast --max=N --logEvery=N --slowMs=N --baseDir=<dir>");
    }

    /** Per-run outcome counts. */
    private static final class Tally {
        int success;
        int fallback;
        int failed;
        int skip;

        String describe() {
            return "success=" + success + " fallback=" + fallback + " failed=" + failed + " skip=" + skip;
        }
    }

    private static long ms(long nanoStart) {
        return (System.nanoTime() - nanoStart) / 1_000_000L;
    }

    private static String safe(String s) {
        return (s == null) ? "" : s;
    }
}
