package com.bankjob.loader;

import java.util.List;

/** The fields of one CSV row and the line it started on. */
public record RecordRow(int line, List<String> fields) {

    public RecordRow {
        fields = List.copyOf(fields);
    }

    /** A line with nothing on it parses as a single empty field. */
    public boolean isBlank() {
        return fields.size() == 1 && fields.get(0).isEmpty();
    }
}
