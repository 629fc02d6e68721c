package astbridge.utils;

/**
 * The global state of the current run.
 */
public class Global {
    public static final String PIR_VERSION = "0.1.0-20220808";

    public static String inputFile;
    public static String outputDirectory;
    public static boolean verbose = false;

    public static long decodeBeginTime;
    public static long decodeEndTime;
    public static long encodeBeginTime;
    public static long encodeEndTime;
}
