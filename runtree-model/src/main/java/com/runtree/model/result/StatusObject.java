package com.runtree.model.result;

import com.runtree.model.AttributeTable;
import com.runtree.model.Coercion;
import com.runtree.model.Coercions;
import com.runtree.model.ModelObject;
import com.runtree.model.Timestamps;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Map;

/**
 * Status, timing and message shared by suites, tests, keywords and control structures.
 *
 * <p>Timing comes in two encodings: start time plus elapsed time (current reports) or start
 * and end time (legacy reports). Whichever is missing is derived from the other two;
 * elapsed time is zero when it cannot be derived.
 *
 * @param <T> the concrete model type
 */
public abstract class StatusObject<T extends StatusObject<T>> extends ModelObject<T> {

    static final Coercion<Status> STATUS = Coercions.enumValue(Status.class, Status::fromValue);

    private Status status = Status.FAIL;
    private LocalDateTime startTime;
    private LocalDateTime endTime;
    private Duration elapsedTime;
    private String message = "";

    public Status getStatus() {
        return status;
    }

    public void setStatus(Status status) {
        this.status = status != null ? status : Status.FAIL;
    }

    public boolean isPassed() {
        return getStatus() == Status.PASS;
    }

    public boolean isFailed() {
        return getStatus() == Status.FAIL;
    }

    public boolean isSkipped() {
        return getStatus() == Status.SKIP;
    }

    public boolean isNotRun() {
        return getStatus() == Status.NOT_RUN;
    }

    public LocalDateTime getStartTime() {
        return startTime;
    }

    public void setStartTime(LocalDateTime startTime) {
        this.startTime = startTime;
    }

    /** Explicit end time, or start time plus explicit elapsed time. */
    public LocalDateTime getEndTime() {
        if (endTime != null) return endTime;
        if (startTime != null && elapsedTime != null) return startTime.plus(elapsedTime);
        return null;
    }

    public void setEndTime(LocalDateTime endTime) {
        this.endTime = endTime;
    }

    /** Explicit elapsed time, or end minus start; {@link Duration#ZERO} when neither is known. */
    public Duration getElapsedTime() {
        if (elapsedTime != null) return elapsedTime;
        if (startTime != null && endTime != null) return Duration.between(startTime, endTime);
        return Duration.ZERO;
    }

    public void setElapsedTime(Duration elapsedTime) {
        this.elapsedTime = elapsedTime;
    }

    public String getMessage() {
        return message;
    }

    public void setMessage(String message) {
        this.message = message != null ? message : "";
    }

    /**
     * Declares {@code status}, {@code start_time}, {@code end_time}, {@code elapsed_time} and
     * {@code message}. A read-only status is used by suites, whose status is computed.
     */
    protected static <T extends StatusObject<T>> AttributeTable.Builder<T> statusAttributes(
            AttributeTable.Builder<T> builder, boolean statusSettable) {
        if (statusSettable) {
            builder.add("status", StatusObject::getStatus, StatusObject::setStatus, STATUS);
        } else {
            builder.readOnly("status", StatusObject::getStatus, STATUS);
        }
        return builder
                .add("start_time", StatusObject::getStartTime, StatusObject::setStartTime, Coercions.DATE_TIME)
                .add("end_time", StatusObject::getEndTime, StatusObject::setEndTime, Coercions.DATE_TIME)
                .add("elapsed_time", StatusObject::getElapsedTime, StatusObject::setElapsedTime, Coercions.DURATION)
                .add("message", StatusObject::getMessage, StatusObject::setMessage, Coercions.STRING);
    }

    /** Appends {@code status}, {@code start_time} (if known), {@code elapsed_time} and a non-empty {@code message}. */
    protected void putStatusData(Map<String, Object> data) {
        data.put("status", getStatus().getValue());
        if (startTime != null) {
            data.put("start_time", Timestamps.format(startTime));
        }
        data.put("elapsed_time", Timestamps.toSeconds(getElapsedTime()));
        if (!message.isEmpty()) {
            data.put("message", message);
        }
    }
}
