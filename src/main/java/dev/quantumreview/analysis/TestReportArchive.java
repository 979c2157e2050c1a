package dev.quantumreview.analysis;

import dev.quantumreview.exception.ReportParseException;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;

/**
 * Pulls XML reports out of a CI artifact archive (zip).
 */
public final class TestReportArchive {

    static final long MAX_ENTRY_BYTES = 20L * 1024 * 1024;

    private TestReportArchive() {
    }

    public static List<String> xmlReports(byte[] archive) {
        List<String> reports = new ArrayList<>();
        try (ZipInputStream zip = new ZipInputStream(new ByteArrayInputStream(archive))) {
            ZipEntry entry;
            while ((entry = zip.getNextEntry()) != null) {
                if (!entry.isDirectory() && entry.getName().toLowerCase(Locale.ROOT).endsWith(".xml")) {
                    reports.add(readEntry(zip, entry.getName()));
                }
            }
        } catch (IOException e) {
            throw new ReportParseException("Unreadable artifact archive: " + e.getMessage(), e);
        }
        return reports;
    }

    private static String readEntry(InputStream in, String name) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        byte[] buffer = new byte[8192];
        long total = 0;
        int n;
        while ((n = in.read(buffer)) != -1) {
            total += n;
            if (total > MAX_ENTRY_BYTES) {
                throw new IOException("Report " + name + " exceeds " + MAX_ENTRY_BYTES + " bytes");
            }
            out.write(buffer, 0, n);
        }
        return out.toString(StandardCharsets.UTF_8);
    }
}
