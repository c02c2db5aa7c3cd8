package com.cnj.saude;

import com.cnj.saude.config.PipelineConfig;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

/**
 * Builds CNJ-shaped fixtures: semicolon-delimited exports packed into zip archives.
 */
public final class TestArchives {

    public static final List<String> SOURCE_HEADER = List.of(
        "Tribunal", "Processo", "Ano", "Classe", "Codigos assuntos",
        "Polo ativo", "Polo ativo - Natureza juridica",
        "Polo passivo", "Polo passivo - Natureza juridica");

    private TestArchives() {
    }

    public static PipelineConfig config(Path workDir) {
        PipelineConfig config = new PipelineConfig();
        config.setInputRoot(workDir.resolve("AnaliseBR"));
        config.setRegionalOutputDir(workDir.resolve("Output_AnaliseBR_Saude"));
        config.setOutputDir(workDir.resolve("out"));
        config.setReportsDir(workDir.resolve("Output_reports"));
        return config;
    }

    /**
     * A source row in {@link #SOURCE_HEADER} order.
     */
    public static List<String> row(String court, String process, String subjects,
                                   String defendant, String defendantNature) {
        return List.of(court, process, "2023", "Procedimento Comum", subjects,
            "Fulano de Tal", "Pessoa Fisica", defendant, defendantNature);
    }

    @SafeVarargs
    public static String csv(List<String> header, List<String>... rows) {
        StringBuilder sb = new StringBuilder(String.join(";", header)).append('\n');
        for (List<String> row : rows) {
            sb.append(String.join(";", row)).append('\n');
        }
        return sb.toString();
    }

    @SafeVarargs
    public static String sourceCsv(List<String>... rows) {
        return csv(SOURCE_HEADER, rows);
    }

    /**
     * Writes a zip at {@code target} with one member per entry, in the given order.
     */
    public static Path zip(Path target, Map<String, String> members) throws IOException {
        Map<String, byte[]> encoded = new LinkedHashMap<>();
        members.forEach((name, content) -> encoded.put(name, content.getBytes(StandardCharsets.UTF_8)));
        return zipBytes(target, encoded);
    }

    /**
     * Same as {@link #zip(Path, Map)} with members given as raw bytes.
     */
    public static Path zipBytes(Path target, Map<String, byte[]> members) throws IOException {
        Files.createDirectories(target.getParent());
        try (OutputStream out = Files.newOutputStream(target);
             ZipOutputStream zip = new ZipOutputStream(out)) {
            for (Map.Entry<String, byte[]> member : members.entrySet()) {
                zip.putNextEntry(new ZipEntry(member.getKey()));
                zip.write(member.getValue());
                zip.closeEntry();
            }
        }
        return target;
    }

    public static Path zip(Path target, String memberName, String content) throws IOException {
        Map<String, String> members = new LinkedHashMap<>();
        members.put(memberName, content);
        return zip(target, members);
    }

    public static Path corruptArchive(Path target) throws IOException {
        Files.createDirectories(target.getParent());
        Files.write(target, "this is not a zip archive".getBytes(StandardCharsets.UTF_8));
        return target;
    }

    /**
     * Writes a plain semicolon-delimited file.
     */
    public static Path writeCsv(Path target, List<String> header, List<List<String>> rows) throws IOException {
        Files.createDirectories(target.toAbsolutePath().getParent());
        List<String> lines = new ArrayList<>();
        lines.add(String.join(";", header));
        for (List<String> row : rows) {
            lines.add(String.join(";", row));
        }
        Files.write(target, lines, StandardCharsets.UTF_8);
        return target;
    }

    public static List<String> cells(String... values) {
        return Arrays.asList(values);
    }
}
