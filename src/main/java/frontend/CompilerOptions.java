package frontend;

// 命令行参数：-f <file.c> [-g <out.dot>] [-n <graphName>] [-s]
public final class CompilerOptions {
    public static final String USAGE = "usage: Compiler -f <file.c> [-g <out.dot>] [-n <graphName>] [-s]";

    private final String inputFile;
    private final String outputFile;
    private final String graphName;
    private final boolean showTree;

    private CompilerOptions(String inputFile, String outputFile, String graphName, boolean showTree) {
        this.inputFile = inputFile;
        this.outputFile = outputFile;
        this.graphName = graphName;
        this.showTree = showTree;
    }

    public static CompilerOptions parse(String... args) {
        String input = null;
        String output = null;
        String graphName = GraphEmitter.DEFAULT_GRAPH_NAME;
        boolean show = false;
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            switch (arg) {
                case "-f":
                    input = value(args, ++i, arg);
                    break;
                case "-g":
                    output = value(args, ++i, arg);
                    break;
                case "-n":
                    graphName = value(args, ++i, arg);
                    break;
                case "-s":
                    show = true;
                    break;
                default:
                    throw new IllegalArgumentException("unknown option '" + arg + "'");
            }
        }
        if (input == null) {
            throw new IllegalArgumentException("missing input file (-f)");
        }
        if (output == null) {
            output = defaultOutput(input);
        }
        return new CompilerOptions(input, output, graphName, show);
    }

    private static String value(String[] args, int index, String option) {
        if (index >= args.length || args[index].isEmpty()) {
            throw new IllegalArgumentException("option " + option + " needs a value");
        }
        return args[index];
    }

    // year.c -> year.dot
    static String defaultOutput(String input) {
        int slash = Math.max(input.lastIndexOf('/'), input.lastIndexOf('\\'));
        int dot = input.lastIndexOf('.');
        String base = dot > slash ? input.substring(0, dot) : input;
        return base + ".dot";
    }

    public String getInputFile() {
        return inputFile;
    }

    public String getOutputFile() {
        return outputFile;
    }

    public String getGraphName() {
        return graphName;
    }

    public boolean isShowTree() {
        return showTree;
    }
}
