package com.github.sheeppig;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.github.sheeppig.parser.Module;
import com.github.sheeppig.parser.Parser;

import lombok.Getter;
import lombok.Setter;
import lombok.experimental.Accessors;

/**
 * Runs the whole front end: tokenize, preprocess, parse. Files are looked up along the configured
 * lookup path, the way module names in {@code using} blocks are.
 */
public class FrontEnd implements ConfigReader.ConfigTarget {

    private final Tokenizer tokenizer = new Tokenizer();
    private final Preprocessor preprocessor = new Preprocessor();
    private final Parser parser = new Parser();

    @Setter
    @Getter
    @Accessors(fluent = true)
    private ModuleResolver resolver = new LookupPathResolver(List.of("."));

    private List<String> lookupPath = List.of(".");
    private String sourceExtension = LookupPathResolver.DEFAULT_EXTENSION;

    @Override
    public void setLookupPath(List<String> lookupPath) {
        this.lookupPath = List.copyOf(lookupPath);
        rebuildResolver();
    }

    @Override
    public void setSourceExtension(String sourceExtension) {
        this.sourceExtension = sourceExtension;
        rebuildResolver();
    }

    /**
     * A resolver installed through {@code resolver(ModuleResolver)} is kept; only the lookup path
     * based one follows the configuration.
     */
    private void rebuildResolver() {
        if (resolver instanceof LookupPathResolver) {
            resolver = new LookupPathResolver(lookupPath, sourceExtension);
        }
    }

    public Tokens tokenize(String source) {
        return preprocessor.preprocess(tokenizer.tokenize(source));
    }

    public Module parse(String source) {
        return parse(Parser.DEFAULT_MODULE_NAME, source);
    }

    public Module parse(Identifier moduleName, String source) {
        return parser.parseModule(tokenize(source), moduleName);
    }

    public ParseResult tryParse(Identifier moduleName, String source) {
        try {
            return new ParseResult.Success(parse(moduleName, source));
        } catch (ParseException e) {
            return new ParseResult.Failure(e);
        }
    }

    public ParseResult tryParse(String source) {
        return tryParse(Parser.DEFAULT_MODULE_NAME, source);
    }

    /**
     * Parses the file at {@code path}. Relative paths are tried against the lookup path first.
     * The module is named after the file without its extension.
     */
    public Module parseFile(String pathString) {
        var path = locate(pathString);
        return parse(moduleNameOf(path), read(path));
    }

    /**
     * Parses the module a {@code using} block would refer to as {@code name}.
     */
    public Module parseModule(Identifier name) {
        var path = resolver.resolve(name)
            .orElseThrow(() -> new IllegalArgumentException("cannot find module " + name.asString()));
        return parse(name, read(path));
    }

    Path locate(String pathString) {
        var path = Path.of(pathString);
        if (!path.isAbsolute()) {
            for (String lookupPathEntry : lookupPath) {
                var candidate = Path.of(lookupPathEntry, pathString);
                if (Files.isRegularFile(candidate)) {
                    return candidate;
                }
            }
        }
        return path;
    }

    private Identifier moduleNameOf(Path path) {
        var fileName = path.getFileName().toString();
        var dot = fileName.lastIndexOf('.');
        var name = dot > 0 ? fileName.substring(0, dot) : fileName;
        return Identifier.of(name);
    }

    private static String read(Path path) {
        try {
            return Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("cannot read " + path, e);
        }
    }

    public static void main(String[] args) {
        var frontEnd = new FrontEnd();
        ConfigReader.readConfig().applyConfig(frontEnd);

        boolean printTokens = false;
        List<String> files = new ArrayList<>();
        for (var arg : args) {
            if (arg.equals("--tokens")) {
                printTokens = true;
            } else {
                files.add(arg);
            }
        }
        if (files.isEmpty()) {
            System.err.println("usage: FrontEnd [--tokens] <file>...");
            System.exit(2);
        }

        for (var file : files) {
            try {
                if (printTokens) {
                    frontEnd.tokenize(read(frontEnd.locate(file))).tokens().forEach(System.out::println);
                } else {
                    System.out.println(frontEnd.parseFile(file));
                }
            } catch (ParseException e) {
                System.err.println(file + ": " + e.getMessage());
                System.exit(1);
            } catch (UncheckedIOException e) {
                System.err.println(e.getMessage());
                System.exit(1);
            }
        }
    }

}
