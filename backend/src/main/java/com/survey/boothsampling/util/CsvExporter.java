package com.survey.boothsampling.util;

import com.opencsv.CSVWriter;
import com.opencsv.ICSVWriter;
import com.survey.boothsampling.dto.RegionSummaryRow;
import com.survey.boothsampling.dto.SelectedBoothRecord;
import com.survey.boothsampling.model.SelectionType;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.util.List;

/**
 * Renders run tables as CSV with the column names field teams already use
 */
public final class CsvExporter {

    private static final String[] BOOTH_HEADER = {
            "state", "district", "district_n", "pc", "pc_name", "ac", "ac_name",
            "booth", "booth_name", "cluster", "latitude", "longitude"
    };

    private CsvExporter() {
    }

    public static String summaryToCsv(List<RegionSummaryRow> rows, SelectionType selectionType) {
        String label = selectionType.getLabel();
        return write(writer -> {
            writer.writeNext(new String[]{
                    label, label + "_Name", "Total_Booths", "Selected_Booths", "Status", "Reason", "Samples_Requested"
            });
            for (RegionSummaryRow row : rows) {
                writer.writeNext(new String[]{
                        row.getCode(),
                        row.getName(),
                        String.valueOf(row.getTotalBooths()),
                        String.valueOf(row.getSelectedBooths()),
                        row.getStatus(),
                        row.getReason(),
                        String.valueOf(row.getSamplesRequested())
                });
            }
        });
    }

    public static String selectedBoothsToCsv(List<SelectedBoothRecord> records) {
        return write(writer -> {
            writer.writeNext(BOOTH_HEADER);
            for (SelectedBoothRecord record : records) {
                writer.writeNext(new String[]{
                        record.getState(),
                        record.getDistrict(),
                        record.getDistrictName(),
                        record.getPc(),
                        record.getPcName(),
                        record.getAc(),
                        record.getAcName(),
                        record.getBooth(),
                        record.getBoothName(),
                        String.valueOf(record.getCluster()),
                        String.valueOf(record.getLatitude()),
                        String.valueOf(record.getLongitude())
                });
            }
        });
    }

    private static String write(RowSink sink) {
        StringWriter out = new StringWriter();
        try (CSVWriter writer = new CSVWriter(out, ICSVWriter.DEFAULT_SEPARATOR, ICSVWriter.DEFAULT_QUOTE_CHARACTER,
                ICSVWriter.DEFAULT_ESCAPE_CHARACTER, ICSVWriter.DEFAULT_LINE_END)) {
            sink.accept(writer);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to render CSV", e);
        }
        return out.toString();
    }

    @FunctionalInterface
    private interface RowSink {
        void accept(CSVWriter writer);
    }
}
