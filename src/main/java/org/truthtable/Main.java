package org.truthtable;

import org.truthtable.operations.OperationDispatcher;
import org.truthtable.operations.OperationResult;
import org.truthtable.parser.FormulaSyntaxException;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * VALUTATORE TABELLE DI VERITÀ - Front end a riga di comando
 *
 * PIPELINE DI ELABORAZIONE:
 * 1. INPUT: file di testo con una richiesta per riga
 * 2. SMISTAMENTO: il simbolo iniziale sceglie l'operazione (S, EQ, C, CL)
 * 3. PARSING: ogni formula viene convertita in albero sintattico (ANTLR)
 * 4. VALUTAZIONE: tabella di verità esaustiva e verdetto
 * 5. OUTPUT: una riga di risultato per ogni riga di input
 *
 * FORMATO RIGHE DI INPUT:
 * - S,formula                   stato semantico
 * - EQ,formula1,formula2        equivalenza semantica
 * - C,[f1,f2,...]               consistenza di un insieme
 * - CL,[f1,f2,...],formula      conseguenza logica
 *
 * MODALITÀ OPERATIVE:
 * - File singolo (-f): elaborazione di un file .txt
 * - Directory (-d): elaborazione di tutti i file .txt di una cartella
 * - Output (-o): scrittura dei risultati in RESULT/ invece che su console
 *
 * Una riga malformata produce "[ERRO, messaggio]" e non interrompe l'elaborazione.
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
    private static final String OUTPUT_PARAM = "-o";

    private static final String INPUT_EXTENSION = ".txt";
    private static final String RESULT_DIRECTORY = "RESULT";
    private static final String RESULT_SUFFIX = "_result.txt";
    private static final String LOGGING_CONFIG = "/logging.properties";

    private Main() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    //endregion

    //region PUNTO PRINCIPALE

    public static void main(String[] args) {
        configureLogging();

        if (args.length == 0) {
            System.out.println("[E] Nessun parametro fornito. Usa -h per visualizzare l'help.");
            return;
        }

        try {
            EvaluatorConfiguration config = new ArgumentParser().parse(args);
            if (config == null) return; // Help mostrato

            if (config.isFileMode) {
                processSingleFile(config);
            } else {
                processDirectoryBatch(config);
            }
        } catch (IllegalArgumentException e) {
            System.out.println("[E] Errore nella validazione dei parametri: " + e.getMessage());
            System.out.println("Usa -h per visualizzare l'help completo.");
            System.exit(1);
        } catch (IOException e) {
            LOGGER.log(Level.SEVERE, "Errore di I/O", e);
            System.out.println("[E] Errore di I/O: " + e.getMessage());
            System.exit(1);
        }
    }

    /**
     * Carica la configurazione di logging dal classpath, se presente.
     */
    private static void configureLogging() {
        try (InputStream config = Main.class.getResourceAsStream(LOGGING_CONFIG)) {
            if (config != null) {
                LogManager.getLogManager().readConfiguration(config);
            }
        } catch (IOException e) {
            System.err.println("[W] Configurazione logging non caricata: " + e.getMessage());
        }
    }

    //endregion

    //region ELABORAZIONE RIGHE

    /**
     * Elabora una sequenza di righe, producendo una riga di output per ogni riga non vuota.
     *
     * @param lines righe di input
     * @param dispatcher dispatcher delle operazioni
     * @return righe di risultato, nello stesso ordine
     */
    static List<String> processLines(List<String> lines, OperationDispatcher dispatcher) {
        List<String> results = new ArrayList<>();
        for (String line : lines) {
            if (line.isBlank()) {
                continue;
            }
            results.add(processLine(line, dispatcher));
        }
        return results;
    }

    static String processLine(String line, OperationDispatcher dispatcher) {
        try {
            OperationResult result = dispatcher.execute(line);
            return result.format();
        } catch (FormulaSyntaxException | IllegalArgumentException e) {
            LOGGER.warning("Riga scartata '" + line + "': " + e.getMessage());
            return "[ERRO, " + e.getMessage() + "]";
        }
    }

    //endregion

    //region ELABORAZIONE FILE E DIRECTORY

    private static void processSingleFile(EvaluatorConfiguration config) throws IOException {
        LOGGER.info("Elaborazione file: " + config.inputPath);
        processFile(Path.of(config.inputPath), config.outputPath == null ? null : Path.of(config.outputPath),
                new OperationDispatcher());
    }

    /**
     * Elabora tutti i file .txt di una directory; un file illeggibile non ferma gli altri.
     */
    private static void processDirectoryBatch(EvaluatorConfiguration config) throws IOException {
        LOGGER.info("Elaborazione directory: " + config.inputPath);

        List<Path> inputFiles;
        try (Stream<Path> entries = Files.list(Path.of(config.inputPath))) {
            inputFiles = entries
                    .filter(Files::isRegularFile)
                    .filter(path -> path.getFileName().toString().toLowerCase().endsWith(INPUT_EXTENSION))
                    .sorted()
                    .collect(Collectors.toList());
        }

        if (inputFiles.isEmpty()) {
            System.out.println("[W] Nessun file " + INPUT_EXTENSION + " trovato in " + config.inputPath);
            return;
        }

        OperationDispatcher dispatcher = new OperationDispatcher();
        Path outputDir = config.outputPath == null ? null : Path.of(config.outputPath);
        int errors = 0;

        for (Path inputFile : inputFiles) {
            try {
                processFile(inputFile, outputDir, dispatcher);
            } catch (IOException e) {
                errors++;
                LOGGER.log(Level.SEVERE, "Errore elaborazione file " + inputFile, e);
            }
        }

        LOGGER.info("Elaborazione completata: " + (inputFiles.size() - errors) + "/" + inputFiles.size()
                + " file elaborati");
    }

    /**
     * Elabora un file di richieste. Con directory di output scrive RESULT/nome_result.txt,
     * altrimenti stampa i risultati su console.
     *
     * @return percorso del file scritto, null se l'output è andato su console
     * @throws IOException se il file non è leggibile o il risultato non è scrivibile
     */
    static Path processFile(Path inputFile, Path outputDir, OperationDispatcher dispatcher) throws IOException {
        List<String> lines = Files.readAllLines(inputFile, StandardCharsets.UTF_8);
        List<String> results = processLines(lines, dispatcher);

        if (outputDir == null) {
            results.forEach(System.out::println);
            return null;
        }

        Path resultDir = outputDir.resolve(RESULT_DIRECTORY);
        Files.createDirectories(resultDir);
        Path resultFile = resultDir.resolve(baseName(inputFile) + RESULT_SUFFIX);
        Files.write(resultFile, results, StandardCharsets.UTF_8);

        LOGGER.info("Risultati salvati in " + resultFile + " (" + results.size() + " righe)");
        return resultFile;
    }

    private static String baseName(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    private static void printApplicationHelp() {
        System.out.println("UTILIZZO:");
        System.out.println("  -f <file>       elabora un file di richieste (una per riga)");
        System.out.println("  -d <directory>  elabora tutti i file .txt della directory");
        System.out.println("  -o <directory>  salva i risultati in <directory>/RESULT");
        System.out.println("  -h              mostra questo messaggio");
        System.out.println();
        System.out.println("RICHIESTE:");
        System.out.println("  S,formula                  stato semantico (TAUTOLOGIA, CONTRADICAO, CONTINGENCIA)");
        System.out.println("  EQ,formula1,formula2       equivalenza semantica (SIM, NAO)");
        System.out.println("  C,[f1,f2,...]              consistenza di un insieme (SIM, NAO)");
        System.out.println("  CL,[f1,f2,...],formula     conseguenza logica (SIM, NAO)");
        System.out.println();
        System.out.println("SINTASSI FORMULE:");
        System.out.println("  variabili p, q1, r23   negazione -   congiunzione &   disgiunzione |");
        System.out.println("  implicazione ->   biimplicazione <->   parentesi ( )");
    }

    //endregion

    //region CLASSI DI SUPPORTO

    /**
     * Configurazione immutabile dell'esecuzione.
     */
    static class EvaluatorConfiguration {
        final String inputPath;
        final String outputPath;
        final boolean isFileMode;

        EvaluatorConfiguration(String inputPath, String outputPath, boolean isFileMode) {
            this.inputPath = inputPath;
            this.outputPath = outputPath;
            this.isFileMode = isFileMode;
        }
    }

    /**
     * Parser dei parametri della linea di comando.
     */
    static class ArgumentParser {

        /**
         * @param args parametri da linea di comando
         * @return configurazione validata, null se è stato richiesto l'help
         * @throws IllegalArgumentException se i parametri non sono validi
         */
        EvaluatorConfiguration parse(String[] args) {
            String inputPath = null;
            String outputPath = null;
            boolean isFileMode = false;
            boolean isDirectoryMode = false;

            for (int i = 0; i < args.length; i++) {
                switch (args[i]) {
                    case HELP_PARAM -> {
                        printApplicationHelp();
                        return null;
                    }
                    case FILE_PARAM -> {
                        if (isDirectoryMode) {
                            throw new IllegalArgumentException("Le modalità file e directory sono mutualmente esclusive");
                        }
                        inputPath = getNextArgument(args, ++i, "file");
                        validateFileExists(inputPath);
                        isFileMode = true;
                    }
                    case DIR_PARAM -> {
                        if (isFileMode) {
                            throw new IllegalArgumentException("Le modalità file e directory sono mutualmente esclusive");
                        }
                        inputPath = getNextArgument(args, ++i, "directory");
                        validateDirectoryExists(inputPath);
                        isDirectoryMode = true;
                    }
                    case OUTPUT_PARAM -> outputPath = getNextArgument(args, ++i, "directory output");
                    default -> throw new IllegalArgumentException("Parametro sconosciuto: " + args[i]);
                }
            }

            if (inputPath == null) {
                throw new IllegalArgumentException("Specificare input con -f (file) o -d (directory)");
            }
            return new EvaluatorConfiguration(inputPath, outputPath, isFileMode);
        }

        private String getNextArgument(String[] args, int currentIndex, String argumentType) {
            if (currentIndex >= args.length) {
                throw new IllegalArgumentException("Parametro " + args[currentIndex - 1] + " richiede " + argumentType);
            }
            return args[currentIndex];
        }

        private void validateFileExists(String filePath) {
            File file = new File(filePath);
            if (!file.isFile()) {
                throw new IllegalArgumentException("File non esistente: " + filePath);
            }
            if (!file.canRead()) {
                throw new IllegalArgumentException("File non leggibile: " + filePath);
            }
        }

        private void validateDirectoryExists(String dirPath) {
            File dir = new File(dirPath);
            if (!dir.isDirectory()) {
                throw new IllegalArgumentException("Directory non esistente: " + dirPath);
            }
        }
    }

    //endregion
}
