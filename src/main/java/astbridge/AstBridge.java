package astbridge;

import astbridge.analyzer.AstFunction;
import astbridge.analyzer.CPrettyPrinter;
import astbridge.base.builder.StorageChecker;
import astbridge.serialize.PirDeserializer;
import astbridge.serialize.PirDocument;
import astbridge.serialize.PirSerializer;
import astbridge.utils.Global;
import astbridge.utils.Logging;
import org.apache.commons.io.FileUtils;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * Command-line entry: reads a PIR document, prints the trees of every function as C
 * and writes the document back out.
 *
 * <p>Arguments are {@code key=value} pairs: {@code input}, {@code output} and optionally {@code verbose}.
 */
public class AstBridge {

    public static void main(String[] args) throws IOException {
        if (!Logging.init()) {
            System.exit(1);
        }
        parseArgs(args);
        prepareOutputDirectory();

        Global.decodeBeginTime = System.currentTimeMillis();
        PirDocument document = new PirDeserializer().read(new File(Global.inputFile));
        Global.decodeEndTime = System.currentTimeMillis();
        Logging.info("AstBridge", String.format("Decoded %s in %d ms", Global.inputFile,
                Global.decodeEndTime - Global.decodeBeginTime));

        for (var function : document.getFunctions()) {
            writeFunction(function);
        }

        Global.encodeBeginTime = System.currentTimeMillis();
        var serializer = new PirSerializer();
        serializer.write(document, new File(Global.outputDirectory, "pir.json"));
        Global.encodeEndTime = System.currentTimeMillis();
        Logging.info("AstBridge", String.format("Encoded %d functions in %d ms", document.getFunctions().size(),
                Global.encodeEndTime - Global.encodeBeginTime));
    }

    private static void writeFunction(AstFunction function) throws IOException {
        var roots = function.getRoots();
        String[] names = roots.size() == 3
                ? new String[]{"high", "propagated", "low"}
                : null;
        for (int i = 0; i < roots.size(); i++) {
            var suffix = names != null ? names[i] : String.valueOf(i);
            var file = new File(Global.outputDirectory, function.name + "." + suffix + ".c");
            FileUtils.writeStringToFile(file, CPrettyPrinter.print(roots.get(i)), StandardCharsets.UTF_8);
        }
        if (Global.verbose) {
            Logging.info("AstBridge", "\n" + CPrettyPrinter.print(function));
            var checker = new StorageChecker(function.getBuilder().getStorage());
            Logging.info("AstBridge", "\n" + checker.check(function.getLowLevelTree()));
        }
    }

    protected static void parseArgs(String[] args) {
        for (String arg : args) {
            Logging.info("AstBridge", "Arg: " + arg);
            String[] argParts = arg.split("=", 2);
            if (argParts.length != 2) {
                Logging.error("AstBridge", "Invalid argument: " + arg);
                System.exit(1);
            }

            String key = argParts[0];
            String value = argParts[1];

            switch (key) {
                case "input" -> Global.inputFile = value;
                case "output" -> Global.outputDirectory = value;
                case "verbose" -> Global.verbose = Boolean.parseBoolean(value);
                default -> {
                    Logging.error("AstBridge", "Invalid argument: " + arg);
                    System.exit(1);
                }
            }
        }
        if (Global.inputFile == null) {
            Logging.error("AstBridge", "Input file not specified");
            System.exit(1);
        }
    }

    protected static void prepareOutputDirectory() throws IOException {
        if (Global.outputDirectory == null) {
            Logging.error("AstBridge", "Output directory not specified");
            System.exit(1);
        }

        File outputDir = new File(Global.outputDirectory);
        if (!outputDir.exists()) {
            FileUtils.forceMkdir(outputDir);
        } else {
            FileUtils.cleanDirectory(outputDir);
        }
    }
}
