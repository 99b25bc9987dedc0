import frontend.ASTNode;
import frontend.ASTPrinter;
import frontend.CompileError;
import frontend.CompilerOptions;
import frontend.GraphEmitter;
import frontend.Parser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

public class Compiler {
    private static final Logger log = LoggerFactory.getLogger(Compiler.class);

    static final int EXIT_OK = 0;
    static final int EXIT_COMPILE_ERROR = 1;
    static final int EXIT_USAGE = 2;

    public static void main(String[] args) {
        System.exit(run(System.out, System.err, args));
    }

    static int run(PrintStream out, PrintStream err, String... args) {
        CompilerOptions options;
        try {
            options = CompilerOptions.parse(args);
        } catch (IllegalArgumentException e) {
            err.println(e.getMessage());
            err.println(CompilerOptions.USAGE);
            return EXIT_USAGE;
        }

        Path input = Paths.get(options.getInputFile());
        String source;
        try {
            source = new String(Files.readAllBytes(input), StandardCharsets.UTF_8);
        } catch (IOException e) {
            err.println("cannot read " + input + ": " + e.getMessage());
            return EXIT_USAGE;
        }

        log.info("Step 1: 语法分析 {}", input);
        ASTNode ast;
        try {
            ast = Parser.parseSource(source, options.getInputFile());
        } catch (CompileError e) {
            err.println(e.getMessage());
            return EXIT_COMPILE_ERROR;
        }
        log.info("语法分析完成，顶层声明数: {}", ast.childCount());

        if (options.isShowTree()) {
            out.print(new ASTPrinter(true).show(ast));
        }

        log.info("Step 2: 生成 DOT 图 {}", options.getOutputFile());
        Path output = Paths.get(options.getOutputFile());
        try (Writer writer = Files.newBufferedWriter(output, StandardCharsets.UTF_8)) {
            new GraphEmitter(options.getGraphName()).emit(ast, writer);
        } catch (IOException e) {
            err.println("cannot write " + output + ": " + e.getMessage());
            return EXIT_USAGE;
        }
        log.info("DOT 图已写入 {}", output);
        return EXIT_OK;
    }
}
