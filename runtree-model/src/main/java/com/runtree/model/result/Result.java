package com.runtree.model.result;

import com.runtree.model.AttributeTable;
import com.runtree.model.Coercions;
import com.runtree.model.DataException;
import com.runtree.model.ModelJson;
import com.runtree.model.ModelObject;
import com.runtree.model.Timestamps;

import java.io.InputStream;
import java.io.Reader;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Root of a reconstructed execution: the top-level suite, execution errors and information
 * about the tool that generated the report.
 */
public final class Result extends ModelObject<Result> {

    private static final AttributeTable<Result> ATTRIBUTES = AttributeTable.<Result>builder("Result")
            .add("generator", Result::getGenerator, Result::setGenerator, Coercions.STRING)
            .add("generated", Result::getGenerated, Result::setGenerated, Coercions.DATE_TIME)
            .add("rpa", Result::getRpa, Result::setRpa, Coercions.BOOLEAN)
            .add("suite", Result::getSuite, Result::setSuite, ResultCoercions.AS_IS)
            .add("errors", result -> result.getErrors().getMessages(), Result::setErrors, ResultCoercions.ITEMS)
            .build();

    private String generator = "unknown";
    private LocalDateTime generated;
    private Boolean rpa;
    private TestSuite suite = new TestSuite();
    private ExecutionErrors errors = new ExecutionErrors();

    public static Result fromDict(Map<String, ?> data) {
        return fromDict(Result::new, data);
    }

    public static Result fromJson(String json) {
        return fromDict(ModelJson.load(json));
    }

    public static Result fromJson(byte[] json) {
        return fromDict(ModelJson.load(json));
    }

    public static Result fromJson(Reader reader) {
        return fromDict(ModelJson.load(reader));
    }

    public static Result fromJson(InputStream in) {
        return fromDict(ModelJson.load(in));
    }

    public static Result fromJson(Path path) {
        return fromDict(ModelJson.load(path));
    }

    @Override
    protected AttributeTable<Result> attributeTable() {
        return ATTRIBUTES;
    }

    /** Name and version of the generating tool; {@code unknown} when the report does not say. */
    public String getGenerator() {
        return generator;
    }

    public void setGenerator(String generator) {
        this.generator = generator != null ? generator : "unknown";
    }

    public LocalDateTime getGenerated() {
        return generated;
    }

    public void setGenerated(LocalDateTime generated) {
        this.generated = generated;
    }

    /** True when the run executed tasks instead of tests; false when not known. */
    public boolean isRpa() {
        return Boolean.TRUE.equals(rpa);
    }

    /** Task mode flag, or null when it has not been set. */
    public Boolean getRpa() {
        return rpa;
    }

    public void setRpa(Boolean rpa) {
        this.rpa = rpa;
    }

    public TestSuite getSuite() {
        return suite;
    }

    /** Accepts a {@link TestSuite} or its dictionary. */
    public void setSuite(Object suite) {
        if (suite instanceof TestSuite testSuite) {
            this.suite = testSuite;
        } else if (suite instanceof Map<?, ?> data) {
            this.suite = TestSuite.fromDict(Body.asData(data));
        } else {
            throw new DataException("Invalid suite '" + suite + "'.");
        }
    }

    public ExecutionErrors getErrors() {
        return errors;
    }

    public void setErrors(List<?> messages) {
        errors.replaceWith(messages);
    }

    @Override
    protected void copyStateDeeply() {
        super.copyStateDeeply();
        suite = suite.deepCopy();
        errors = errors.deepCopy();
    }

    @Override
    public Map<String, Object> toDict() {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("generator", generator);
        if (generated != null) data.put("generated", Timestamps.format(generated));
        data.put("rpa", isRpa());
        data.put("suite", suite.toDict());
        data.put("errors", errors.toDicts());
        return data;
    }

    @Override
    protected List<String> reprAttributes() {
        return List.of("generator", "rpa");
    }
}
