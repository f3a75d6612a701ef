package com.runtree.xml.handlers;

import com.runtree.model.DataException;
import com.runtree.model.Timestamps;
import com.runtree.model.result.Status;
import com.runtree.model.result.StatusObject;
import com.runtree.xml.InvalidElementException;
import com.runtree.xml.LegacyTimestamps;
import com.runtree.xml.ReportElement;

import java.time.DateTimeException;

/**
 * {@code <status>}: status, timing and message of the enclosing node.
 *
 * <p>Timing is {@code start} plus {@code elapsed} seconds, or in older reports the
 * {@code starttime}/{@code endtime} pair. Status defaults to FAIL. The variant used under
 * suites leaves the status alone.
 */
final class StatusHandler extends AbstractElementHandler {

    private final boolean setStatus;

    StatusHandler(boolean setStatus) {
        super("status");
        this.setStatus = setStatus;
    }

    @Override
    public void end(ReportElement element, Object node) {
        if (!(node instanceof StatusObject<?> target)) {
            throw new InvalidElementException(element.getTag(), node);
        }
        try {
            if (setStatus) {
                target.setStatus(Status.fromValue(element.get("status", "FAIL")));
            }
            if (element.has("elapsed")) {
                target.setElapsedTime(Timestamps.seconds(Double.parseDouble(element.get("elapsed"))));
                String start = element.get("start");
                target.setStartTime(start == null || start.isEmpty() ? null : Timestamps.parse(start));
            } else {
                target.setStartTime(LegacyTimestamps.parse(element.get("starttime")));
                target.setEndTime(LegacyTimestamps.parse(element.get("endtime")));
            }
        } catch (IllegalArgumentException | DateTimeException e) {
            throw new DataException("Invalid status " + element + ": " + e.getMessage(), e);
        }
        if (element.hasText()) {
            target.setMessage(element.getText());
        }
    }
}
