package com.runtree.model;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.json.JsonWriteFeature;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Map ↔ JSON text codec behind {@code fromJson}/{@code toJson}. Objects are read into
 * insertion-ordered maps so that attribute order in the data is preserved.
 */
public final class ModelJson {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
            .configure(JsonGenerator.Feature.AUTO_CLOSE_TARGET, false);

    private static final TypeReference<LinkedHashMap<String, Object>> DATA_TYPE = new TypeReference<>() {};

    private ModelJson() {
    }

    /**
     * Reads a JSON object from text.
     *
     * @throws DataException if the text is not a JSON object
     */
    public static Map<String, Object> load(String json) {
        try {
            return requireObject(MAPPER.readValue(json, DATA_TYPE));
        } catch (JsonProcessingException e) {
            throw loadingFailed(e);
        }
    }

    public static Map<String, Object> load(byte[] json) {
        try {
            return requireObject(MAPPER.readValue(json, DATA_TYPE));
        } catch (IOException e) {
            throw loadingFailed(e);
        }
    }

    public static Map<String, Object> load(Reader reader) {
        try {
            return requireObject(MAPPER.readValue(reader, DATA_TYPE));
        } catch (IOException e) {
            throw loadingFailed(e);
        }
    }

    public static Map<String, Object> load(InputStream in) {
        try {
            return requireObject(MAPPER.readValue(in, DATA_TYPE));
        } catch (IOException e) {
            throw loadingFailed(e);
        }
    }

    /** Reads a UTF-8 encoded JSON file. */
    public static Map<String, Object> load(Path path) {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return load(reader);
        } catch (IOException e) {
            throw loadingFailed(e);
        }
    }

    public static String write(Object data, JsonFormat format) {
        try {
            return writer(format).writeValueAsString(data);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    /** Writes to the given sink; the sink is flushed but not closed. */
    public static void write(Object data, Writer out, JsonFormat format) {
        try {
            writer(format).writeValue(out, data);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /** Writes UTF-8 encoded JSON to the file, replacing existing content. */
    public static void write(Object data, Path path, JsonFormat format) {
        try (Writer out = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            write(data, out, format);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static ObjectWriter writer(JsonFormat format) {
        ObjectWriter writer = MAPPER.writer(format.prettyPrinter());
        if (format.isEnsureAscii()) {
            writer = writer.with(JsonWriteFeature.ESCAPE_NON_ASCII);
        }
        return writer;
    }

    private static Map<String, Object> requireObject(Map<String, Object> data) {
        if (data == null) {
            throw new DataException("Loading JSON data failed: expected a JSON object, got null.");
        }
        return data;
    }

    private static DataException loadingFailed(IOException e) {
        String detail = e instanceof JsonProcessingException jpe ? jpe.getOriginalMessage() : e.getMessage();
        return new DataException("Loading JSON data failed: " + detail, e);
    }
}
