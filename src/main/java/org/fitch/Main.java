package org.fitch;

import org.fitch.checker.ProofResult;
import org.fitch.formula.VariableNames;
import org.fitch.proof.ProofParseException;
import org.fitch.proof.ProofParser;
import org.fitch.proof.Rule;
import org.fitch.support.ErrorReport;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;
import java.util.stream.Stream;

/**
 * VERIFICATORE DI DIMOSTRAZIONI FITCH - Interfaccia a linea di comando
 *
 * PIPELINE DI ELABORAZIONE:
 * 1. INPUT: dimostrazione da file di testo, oppure tutti i .txt di una directory
 * 2. PARSING: struttura della dimostrazione e formule (ANTLR)
 * 3. VERIFICA: regole, citazioni e sottoprove, più il modello opzionale dell'esercizio
 * 4. OUTPUT: esito della verifica oppure la dimostrazione trasformata
 *
 * MODALITÀ OPERATIVE SUPPORTATE:
 * - File singolo (-f) o directory batch (-d)
 * - Modello dell'esercizio (-template): una formula per riga, premesse poi conclusione
 * - Variabili ammesse (-vars=x,y,z)
 * - Errori con riga reale del file (-v)
 * - Trasformazioni al posto della verifica: -format, -fix, -latex
 *
 * Il codice di uscita è 0 solo se ogni dimostrazione elaborata è corretta
 * (o, per le trasformazioni, analizzabile).
 */
public final class Main {

    private static final Logger LOGGER = Logger.getLogger(Main.class.getName());

    //region CONFIGURAZIONE PARAMETRI APPLICAZIONE

    /**
     * Parametri linea di comando supportati
     * */
    private static final String HELP_PARAM = "-h";
    private static final String FILE_PARAM = "-f";
    private static final String DIR_PARAM = "-d";
    private static final String TEMPLATE_PARAM = "-template";
    private static final String VARS_PARAM = "-vars=";
    private static final String VERBOSE_PARAM = "-v";
    private static final String FORMAT_PARAM = "-format";
    private static final String FIX_PARAM = "-fix";
    private static final String LATEX_PARAM = "-latex";

    private static final String LOGGING_CONFIGURATION = "/logging.properties";

    static final int EXIT_SUCCESS = 0;
    static final int EXIT_FAILURE = 1;

    /**
     * Previene istanziazione - classe utility
     * */
    private Main() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    //endregion

    //region PUNTO PRINCIPALE

    /**
     * Punto principale dell'applicazione.
     *
     * @param args parametri linea di comando forniti dall'utente
     */
    public static void main(String[] args) {
        configureLogging();
        System.exit(run(args));
    }

    /**
     * Esegue l'intero flusso e restituisce il codice di uscita, senza terminare la JVM.
     *
     * @param args parametri linea di comando
     * @return 0 se tutte le dimostrazioni sono corrette, 1 altrimenti
     */
    static int run(String[] args) {
        try {
            if (args.length == 0) {
                System.out.println("[E] Nessun parametro fornito. Usa -h per visualizzare l'help.");
                return EXIT_FAILURE;
            }

            CheckerConfiguration config = parseAndValidateArguments(args);
            if (config == null) {
                return isHelpRequest(args) ? EXIT_SUCCESS : EXIT_FAILURE;
            }

            return executeMainPipeline(config);

        } catch (Exception e) {
            LOGGER.log(Level.SEVERE, "Errore critico nell'applicazione", e);
            System.out.println("[E] Errore critico nell'applicazione: " + e.getMessage());
            return EXIT_FAILURE;
        }
    }

    private static int executeMainPipeline(CheckerConfiguration config) throws IOException {
        if (config.isFileMode) {
            return processSingleFile(new File(config.inputPath), config) ? EXIT_SUCCESS : EXIT_FAILURE;
        }
        return processDirectoryBatch(config);
    }

    private static boolean isHelpRequest(String[] args) {
        return List.of(args).contains(HELP_PARAM);
    }

    /**
     * Carica la configurazione di java.util.logging dal classpath; in sua assenza
     * resta quella predefinita della JVM.
     */
    private static void configureLogging() {
        try (InputStream config = Main.class.getResourceAsStream(LOGGING_CONFIGURATION)) {
            if (config != null) {
                LogManager.getLogManager().readConfiguration(config);
            }
        } catch (IOException e) {
            LOGGER.log(Level.WARNING, "Configurazione logging non caricata", e);
        }
    }

    //endregion

    //region PARSING E VALIDAZIONE PARAMETRI

    /**
     * @return configurazione validata o null se help/errore
     */
    private static CheckerConfiguration parseAndValidateArguments(String[] args) {
        try {
            return new ArgumentParser().parse(args);
        } catch (IllegalArgumentException e) {
            System.out.println("[E] Errore nella validazione dei parametri: " + e.getMessage());
            System.out.println("Usa -h per visualizzare l'help completo.");
            return null;
        }
    }

    //endregion

    //region ELABORAZIONE DEL SINGOLO FILE

    /**
     * Elabora un file secondo la modalità configurata.
     *
     * @return true se la dimostrazione è corretta (o la trasformazione è riuscita)
     */
    private static boolean processSingleFile(File file, CheckerConfiguration config) throws IOException {
        String proofText = Files.readString(file.toPath(), StandardCharsets.UTF_8);
        LOGGER.info("Elaborazione di " + file.getName() + " in modalità " + config.mode);

        return switch (config.mode) {
            case CHECK -> checkProofFile(file, proofText, config);
            case FORMAT -> isParseable(file, proofText, config)
                    && printTransformation(FitchProof.formatProof(proofText, config.variables));
            case FIX -> isParseable(file, proofText, config)
                    && printTransformation(FitchProof.fixLineNumbers(proofText, config.variables));
            case LATEX -> exportLatex(file, proofText, config);
        };
    }

    private static boolean checkProofFile(File file, String proofText, CheckerConfiguration config) {
        ProofResult result = FitchProof.checkWithTemplate(proofText, config.template, config.variables);

        System.out.println("[I] " + file.getName() + ": " + result.getOutcome());
        System.out.println(ErrorReport.render(result, config.verbose));
        return result.isCorrect();
    }

    private static boolean isParseable(File file, String proofText, CheckerConfiguration config) {
        try {
            new ProofParser(VariableNames.parse(config.variables)).parse(proofText);
            return true;
        } catch (ProofParseException e) {
            System.out.println("[E] " + file.getName() + ": " + ErrorReport.FATAL_PREFIX + e.getMessage());
            return false;
        }
    }

    private static boolean printTransformation(String transformed) {
        System.out.println(transformed);
        return true;
    }

    private static boolean exportLatex(File file, String proofText, CheckerConfiguration config) {
        try {
            System.out.print(FitchProof.toLatex(proofText, config.variables));
            return true;
        } catch (ProofParseException e) {
            System.out.println("[E] " + file.getName() + ": " + ErrorReport.FATAL_PREFIX + e.getMessage());
            return false;
        }
    }

    //endregion

    //region ELABORAZIONE DELLA DIRECTORY

    private static int processDirectoryBatch(CheckerConfiguration config) throws IOException {
        System.out.println("[I] Inizio elaborazione directory: " + config.inputPath);

        List<File> txtFiles = findAllTxtFiles(config.inputPath);
        if (txtFiles.isEmpty()) {
            System.out.println("[W] Nessun file .txt trovato nella directory specificata.");
            return EXIT_SUCCESS;
        }

        BatchResult result = new BatchResult(txtFiles.size());
        for (File file : txtFiles) {
            try {
                if (processSingleFile(file, config)) {
                    result.incrementSuccess();
                } else {
                    result.incrementFailure();
                }
            } catch (IOException e) {
                System.out.println("[E] Errore nel file " + file.getName() + ": " + e.getMessage());
                result.incrementFailure();
            }
            System.out.println();
        }

        displayBatchSummary(result);
        return result.failureCount == 0 ? EXIT_SUCCESS : EXIT_FAILURE;
    }

    /**
     * Trova tutti i file .txt nella directory specificata.
     *
     * @return lista ordinata per nome
     */
    private static List<File> findAllTxtFiles(String dirPath) throws IOException {
        try (Stream<Path> paths = Files.list(Paths.get(dirPath))) {
            return paths.filter(path -> path.toString().toLowerCase(Locale.ROOT).endsWith(".txt"))
                    .map(Path::toFile)
                    .sorted(Comparator.comparing(File::getName))
                    .toList();
        }
    }

    private static void displayBatchSummary(BatchResult result) {
        System.out.println("-->> RIEPILOGO ELABORAZIONE DIRECTORY <<--");
        System.out.println("Dimostrazioni trovate: " + result.totalFiles);
        System.out.println("Dimostrazioni corrette: " + result.successCount);
        System.out.println("Dimostrazioni con errori: " + result.failureCount);
        System.out.println("=========================================");
    }

    //endregion

    //region HELP E DOCUMENTAZIONE

    private static void printApplicationHelp() {
        System.out.println("""
                VERIFICATORE DI DIMOSTRAZIONI FITCH

                UTILIZZO:
                  java -jar fitch-checker.jar -f <file> [opzioni]
                  java -jar fitch-checker.jar -d <directory> [opzioni]

                PARAMETRI:
                  -f <file>           Verifica una singola dimostrazione
                  -d <directory>      Verifica tutti i file .txt della directory
                  -template <file>    Modello dell'esercizio: una formula per riga,
                                      premesse nell'ordine richiesto e conclusione per ultima
                  -vars=<lista>       Variabili ammesse, separate da virgole (default: %s)
                  -v                  Errori con la riga reale del file
                  -format             Stampa la dimostrazione impaginata
                  -fix                Stampa la dimostrazione rinumerata
                  -latex              Stampa la dimostrazione per il pacchetto LaTeX fitch
                  -h                  Mostra questo messaggio

                FORMATO RIGA:
                  <numero> | <formula> [<regola>: <citazioni>]

                REGOLE:
                  %s
                """.formatted(VariableNames.DEFAULT_CONFIGURATION, String.join(", ", Rule.displayNames())));
    }

    //endregion

    //region CLASSI DI SUPPORTO E CONFIGURAZIONE

    private enum Mode {
        CHECK,
        FORMAT,
        FIX,
        LATEX
    }

    /**
     * Configurazione validata dell'applicazione.
     */
    private static class CheckerConfiguration {
        final String inputPath;
        final boolean isFileMode;
        final List<String> template;
        final String variables;
        final boolean verbose;
        final Mode mode;

        CheckerConfiguration(String inputPath, boolean isFileMode, List<String> template,
                             String variables, boolean verbose, Mode mode) {
            this.inputPath = inputPath;
            this.isFileMode = isFileMode;
            this.template = template;
            this.variables = variables;
            this.verbose = verbose;
            this.mode = mode;
        }
    }

    /**
     * Parser dei parametri linea di comando con validazione completa.
     */
    private static class ArgumentParser {

        /**
         * @return configurazione validata (null se help richiesto)
         * @throws IllegalArgumentException se i parametri non sono validi
         */
        CheckerConfiguration parse(String[] args) {
            String inputPath = null;
            boolean isFileMode = false;
            boolean isDirectoryMode = false;
            List<String> template = null;
            String variables = VariableNames.DEFAULT_CONFIGURATION;
            boolean verbose = false;
            Mode mode = Mode.CHECK;

            for (int i = 0; i < args.length; i++) {
                switch (args[i]) {
                    case HELP_PARAM -> {
                        printApplicationHelp();
                        return null;
                    }
                    case FILE_PARAM -> {
                        validateExclusiveMode(isDirectoryMode, "file");
                        inputPath = getNextArgument(args, ++i, "file");
                        validateFileExists(inputPath);
                        isFileMode = true;
                    }
                    case DIR_PARAM -> {
                        validateExclusiveMode(isFileMode, "directory");
                        inputPath = getNextArgument(args, ++i, "directory");
                        validateDirectoryExists(inputPath);
                        isDirectoryMode = true;
                    }
                    case TEMPLATE_PARAM -> {
                        String templatePath = getNextArgument(args, ++i, "modello");
                        validateFileExists(templatePath);
                        template = readTemplate(templatePath);
                    }
                    case VERBOSE_PARAM -> verbose = true;
                    case FORMAT_PARAM -> mode = selectMode(mode, Mode.FORMAT);
                    case FIX_PARAM -> mode = selectMode(mode, Mode.FIX);
                    case LATEX_PARAM -> mode = selectMode(mode, Mode.LATEX);
                    default -> {
                        if (args[i].startsWith(VARS_PARAM)) {
                            variables = args[i].substring(VARS_PARAM.length());
                            VariableNames.parse(variables);
                        } else {
                            throw new IllegalArgumentException("Parametro sconosciuto: " + args[i]);
                        }
                    }
                }
            }

            if (inputPath == null) {
                throw new IllegalArgumentException("Specificare un file (-f) o una directory (-d)");
            }
            return new CheckerConfiguration(inputPath, isFileMode, template, variables, verbose, mode);
        }

        private void validateExclusiveMode(boolean otherMode, String currentMode) {
            if (otherMode) {
                throw new IllegalArgumentException("Modalità " + currentMode
                        + " non può essere combinata con altre modalità (file/directory sono mutualmente esclusive)");
            }
        }

        private Mode selectMode(Mode current, Mode requested) {
            if (current != Mode.CHECK && current != requested) {
                throw new IllegalArgumentException("Le opzioni -format, -fix e -latex sono mutualmente esclusive");
            }
            return requested;
        }

        private String getNextArgument(String[] args, int index, String paramName) {
            if (index >= args.length) {
                throw new IllegalArgumentException("Parametro " + paramName + " richiede un valore");
            }
            return args[index];
        }

        private void validateFileExists(String filePath) {
            File file = new File(filePath);
            if (!file.isFile() || !file.canRead()) {
                throw new IllegalArgumentException("File non esistente o non leggibile: " + filePath);
            }
        }

        private void validateDirectoryExists(String dirPath) {
            File dir = new File(dirPath);
            if (!dir.isDirectory() || !dir.canRead()) {
                throw new IllegalArgumentException("Directory non esistente o non leggibile: " + dirPath);
            }
        }

        /**
         * Una formula per riga; le righe vuote sono ignorate.
         */
        private List<String> readTemplate(String templatePath) {
            try {
                List<String> entries = new ArrayList<>();
                for (String line : Files.readAllLines(Paths.get(templatePath), StandardCharsets.UTF_8)) {
                    if (!line.isBlank()) {
                        entries.add(line.trim());
                    }
                }
                return entries;
            } catch (IOException e) {
                throw new IllegalArgumentException("Modello non leggibile: " + templatePath, e);
            }
        }
    }

    /**
     * Risultato elaborazione batch.
     */
    private static class BatchResult {
        final int totalFiles;
        int successCount = 0;
        int failureCount = 0;

        BatchResult(int totalFiles) {
            this.totalFiles = totalFiles;
        }

        void incrementSuccess() { successCount++; }
        void incrementFailure() { failureCount++; }
    }

    //endregion
}
