package gmlmath.exec;

import gmlmath.base.grammars.GmlErrorListener;
import gmlmath.base.grammars.GmlLexer;
import gmlmath.base.grammars.GmlParser;
import gmlmath.base.grammars.GmlTreeBuilder;
import gmlmath.hir.Expression;
import gmlmath.hir.PrintTools;
import gmlmath.hir.Program;
import gmlmath.hir.Tools;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.ParserRuleContext;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;

/**
* Front end that parses GML source text into the IR using the ANTLR-generated
* lexer and parser. Comments stay in the token stream and are attached to the
* IR by {@link GmlTreeBuilder}.
*/
public class Parser {

    /**
    * Parses a whole script.
    *
    * @param source the GML source text.
    * @return the program.
    * @throws ParseException if the text has a syntax error.
    */
    public Program parse(String source) throws ParseException {
        double timer = Tools.getTime();
        GmlErrorListener errors = new GmlErrorListener(source);
        CommonTokenStream tokens = tokenize(source, errors);
        GmlParser parser = createParser(tokens, errors);
        GmlParser.ProgramContext tree = parser.program();
        check(errors);
        Program program = (Program)build(tree, tokens, source);
        PrintTools.printlnStatus(2, "[Parser]", source.length(), "chars in",
                String.format("%.2f seconds", Tools.getTime(timer)));
        return program;
    }

    /**
    * Parses a single expression. The returned expression has no parent.
    *
    * @param source the expression text.
    * @return the expression.
    * @throws ParseException if the text is not exactly one expression.
    */
    public Expression parseExpression(String source) throws ParseException {
        GmlErrorListener errors = new GmlErrorListener(source);
        CommonTokenStream tokens = tokenize(source, errors);
        GmlParser parser = createParser(tokens, errors);
        GmlParser.SingleExpressionContext tree = parser.singleExpression();
        check(errors);
        return (Expression)build(tree, tokens, source);
    }

    /**
    * Parses the script stored in the given file, read as UTF-8.
    *
    * @param file the script file.
    * @return the program.
    * @throws IOException if the file cannot be read.
    * @throws ParseException if the text has a syntax error.
    */
    public Program parse(File file) throws IOException, ParseException {
        String source = new String(Files.readAllBytes(file.toPath()),
                StandardCharsets.UTF_8);
        PrintTools.printlnStatus(1, "[Parser]", file.getPath());
        return parse(source);
    }

    private static CommonTokenStream
            tokenize(String source, GmlErrorListener errors) {
        GmlLexer lexer = new GmlLexer(CharStreams.fromString(source));
        lexer.removeErrorListeners();
        lexer.addErrorListener(errors);
        CommonTokenStream tokens = new CommonTokenStream(lexer);
        tokens.fill();
        return tokens;
    }

    private static GmlParser
            createParser(CommonTokenStream tokens, GmlErrorListener errors) {
        GmlParser parser = new GmlParser(tokens);
        parser.removeErrorListeners();
        parser.addErrorListener(errors);
        return parser;
    }

    private static void check(GmlErrorListener errors) throws ParseException {
        if (errors.hasError()) {
            throw new ParseException(errors.getMessage(), errors.getLine(),
                    errors.getColumn());
        }
    }

    private static Object build(ParserRuleContext tree,
            CommonTokenStream tokens, String source) {
        return new GmlTreeBuilder(tokens, source).visit(tree);
    }

}
