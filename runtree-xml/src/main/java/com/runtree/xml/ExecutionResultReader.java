package com.runtree.xml;

import com.runtree.config.RunTreeConfig;
import com.runtree.model.DataException;
import com.runtree.model.result.Result;
import com.runtree.model.result.TestSuite;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.xml.stream.XMLStreamException;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Entry point: reads an XML execution report into a {@link Result}.
 *
 * <p>Reports of current and older formats are accepted. With
 * {@link RunTreeConfig#isIncludeKeywords()} false, keyword and control structure bodies are
 * not built; suite and test setups and teardowns are kept with their status.
 * Every failure is a {@link DataException}; no partial result is returned.
 */
public final class ExecutionResultReader {

    private static final Logger log = LoggerFactory.getLogger(ExecutionResultReader.class);

    private final RunTreeConfig config;
    private final ElementHandlerRegistry registry;

    public ExecutionResultReader() {
        this(RunTreeConfig.fromEnvironment());
    }

    public ExecutionResultReader(RunTreeConfig config) {
        this(config, ElementHandlerRegistry.standard());
    }

    public ExecutionResultReader(RunTreeConfig config, ElementHandlerRegistry registry) {
        this.config = config;
        this.registry = registry;
    }

    public RunTreeConfig getConfig() {
        return config;
    }

    public Result read(Path path) {
        try (InputStream in = Files.newInputStream(path)) {
            return read(in, path.toString());
        } catch (IOException e) {
            throw new DataException("Reading execution result '" + path + "' failed: " + e.getMessage(), e);
        }
    }

    /** Reads from the stream without closing it. */
    public Result read(InputStream in) {
        return read(in, "<stream>");
    }

    /**
     * Reads XML text when the value starts with {@code <}, a file path otherwise.
     */
    public Result read(String source) {
        if (source.stripLeading().startsWith("<")) {
            return read(new ByteArrayInputStream(source.getBytes(StandardCharsets.UTF_8)), "<string>");
        }
        return read(Path.of(source));
    }

    private Result read(InputStream in, String source) {
        log.debug("Reading execution result from {} (includeKeywords={})", source, config.isIncludeKeywords());
        Result result = new Result();
        ElementStack stack = new ElementStack(result, registry, SubtreeFilter.forKeywords(config.isIncludeKeywords()));
        try {
            ReportEvents.stream(in, stack);
        } catch (XMLStreamException e) {
            throw new DataException("Reading execution result '" + source + "' failed: " + e.getMessage(), e);
        }
        if (stack.depth() != 0) {
            throw new DataException("Reading execution result '" + source + "' failed: document ended unexpectedly.");
        }
        TestSuite suite = result.getSuite();
        log.info("Read execution result from {}: suite '{}' with {} tests, {} errors",
                source, suite.getName(), suite.getTestCount(), result.getErrors().size());
        return result;
    }
}
