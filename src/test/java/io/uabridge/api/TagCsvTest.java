package io.uabridge.api;

import io.uabridge.model.TagExportRecord;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;

final class TagCsvTest {

    @Test
    void writesHeaderThenOneRowPerTag() throws Exception {
        String csv = TagCsv.render(List.of(
                new TagExportRecord("ns=2;s=Flow", "Flow", "Int32", "litres, per minute", "A/Flow"),
                new TagExportRecord("ns=2;s=Level", "Level", "Float", null, "A/B/Level")
        ));

        String[] lines = csv.split("\r?\n");
        Assertions.assertEquals("NodeID,Name,DataType,Description,Path", lines[0]);
        Assertions.assertEquals("ns=2;s=Flow,Flow,Int32,\"litres, per minute\",A/Flow", lines[1]);
        Assertions.assertEquals("ns=2;s=Level,Level,Float,,A/B/Level", lines[2]);
        Assertions.assertEquals(3, lines.length);
    }
}
