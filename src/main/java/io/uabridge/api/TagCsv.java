package io.uabridge.api;

import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import io.uabridge.model.TagExportRecord;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * CSV rendering of exported tags, one row per variable under a fixed header.
 */
public final class TagCsv {
    private static final CsvMapper CSV = new CsvMapper();
    private static final CsvSchema SCHEMA = CsvSchema.builder()
            .addColumn("NodeID")
            .addColumn("Name")
            .addColumn("DataType")
            .addColumn("Description")
            .addColumn("Path")
            .setUseHeader(true)
            .build();

    private TagCsv() {
    }

    public static String render(List<TagExportRecord> tags) throws IOException {
        List<String[]> rows = new ArrayList<>(tags.size());
        for (TagExportRecord tag : tags) {
            rows.add(new String[]{
                    nullToEmpty(tag.nodeId()),
                    nullToEmpty(tag.name()),
                    nullToEmpty(tag.dataType()),
                    nullToEmpty(tag.description()),
                    nullToEmpty(tag.path())
            });
        }
        return CSV.writer(SCHEMA).writeValueAsString(rows);
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
