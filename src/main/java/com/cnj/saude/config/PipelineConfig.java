package com.cnj.saude.config;

import com.cnj.saude.tabular.CsvDialect;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.StandardCharsets;
import java.nio.charset.UnsupportedCharsetException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Settings shared by the extraction and analysis pipelines.
 *
 * <p>Built once per invocation (defaults, then YAML, then CLI overrides) and handed to each
 * component's constructor. Nothing in the pipeline reads configuration from global state.
 */
public class PipelineConfig {

    private static final Logger log = LoggerFactory.getLogger(PipelineConfig.class);

    public static final String CONSOLIDATED_BASE_NAME = "DADOS_CNJ_FILTRADOS_SAUDE_CONSOLIDADO";
    public static final String REGIONAL_FILE_PREFIX = "dados_saude_";
    public static final String CSV_EXTENSION = ".csv";

    public static final List<String> DEFAULT_REGIONS = List.of("NE", "NO", "SE", "SU", "CO", "TRFs");

    public static final String COLUMN_COURT = "Tribunal";
    public static final String COLUMN_PROCESS = "Processo";
    public static final String COLUMN_YEAR = "Ano";
    public static final String COLUMN_SUBJECT_CODES = "Codigos assuntos";
    public static final String COLUMN_ACTIVE_PARTY = "Polo ativo";
    public static final String COLUMN_ACTIVE_NATURE = "Polo ativo - Natureza juridica";
    public static final String COLUMN_PASSIVE_PARTY = "Polo passivo";
    public static final String COLUMN_PASSIVE_NATURE = "Polo passivo - Natureza juridica";

    public static final List<String> DEFAULT_PROJECTED_COLUMNS = List.of(
        COLUMN_COURT,
        COLUMN_PROCESS,
        COLUMN_YEAR,
        COLUMN_SUBJECT_CODES,
        COLUMN_ACTIVE_PARTY,
        COLUMN_ACTIVE_NATURE,
        COLUMN_PASSIVE_PARTY,
        COLUMN_PASSIVE_NATURE
    );

    public static final List<String> DEFAULT_ANALYSIS_COLUMNS = List.of(
        COLUMN_SUBJECT_CODES,
        COLUMN_ACTIVE_NATURE,
        COLUMN_PASSIVE_NATURE,
        COLUMN_ACTIVE_PARTY,
        COLUMN_PASSIVE_PARTY
    );

    // Public health (SUS) subject codes from the CNJ subject table; supplementary health excluded.
    public static final Set<Integer> DEFAULT_SUBJECT_CODES = Set.of(
        12480, 12481, 12482, 12483, 12484, 12485, 12486, 12487, 12488, 12489,
        12490, 12491, 12492, 12493, 12494, 12495, 12496, 12497, 12498, 12499,
        12500, 12501, 12502, 12503, 12504, 12505, 12506, 12507, 12508, 12509,
        12510, 12511, 12512, 12513, 12514, 12515, 12516, 12517, 12518, 12519,
        12520, 12521, 14759, 14760
    );

    public static final List<String> DEFAULT_PUBLIC_ENTITY_KEYWORDS = List.of(
        "ORGAO PUBLICO",
        "ESTADO OU DISTRITO FEDERAL",
        "MUNICIPIO",
        "AUTARQUIA",
        "FUNDACAO PUBLICA",
        "UNIAO",
        "SECRETARIA",
        "PROCURADORIA",
        "FAZENDA",
        "FEDERAL",
        "ESTADUAL",
        "MUNICIPAL",
        "INSTITUTO NACIONAL DO SEGURO SOCIAL",
        "ADVOCACIA GERAL DA UNIAO"
    );

    // Paths
    private Path inputRoot = Path.of("AnaliseBR");
    private Path regionalOutputDir = Path.of("Output_AnaliseBR_Saude");
    private Path outputDir = Path.of(".");
    private Path reportsDir = Path.of("Output_reports");

    // CSV dialect
    private char delimiter = ';';
    private Charset encoding = StandardCharsets.UTF_8;

    // Extraction
    private List<String> regions = new ArrayList<>(DEFAULT_REGIONS);
    private String subjectCodeColumn = COLUMN_SUBJECT_CODES;
    private Set<Integer> subjectCodes = new LinkedHashSet<>(DEFAULT_SUBJECT_CODES);
    private List<String> projectedColumns = new ArrayList<>(DEFAULT_PROJECTED_COLUMNS);
    private String neutralMarker = "";
    private boolean strictSchema = false;

    // Analysis
    private List<String> analysisColumns = new ArrayList<>(DEFAULT_ANALYSIS_COLUMNS);
    private String processNumberColumn = COLUMN_PROCESS;
    private String defendantNatureColumn = COLUMN_PASSIVE_NATURE;
    private List<String> publicEntityKeywords = new ArrayList<>(DEFAULT_PUBLIC_ENTITY_KEYWORDS);
    private boolean multiValued = false;
    private boolean includeRegional = false;

    // Report
    private String reportBaseName = "analise_saude_cnj";
    private int topN = 10;
    private int publicDefendantStartPage = 0;
    private boolean pdfEnabled = true;

    // Console output
    private boolean quiet = false;

    public PipelineConfig() {
    }

    public static PipelineConfig fromYaml(String filePath) throws IOException {
        Yaml yaml = new Yaml();
        try (InputStream input = new FileInputStream(filePath)) {
            Map<String, Object> data = yaml.load(input);
            return data == null ? new PipelineConfig() : fromMap(data);
        }
    }

    @SuppressWarnings("unchecked")
    static PipelineConfig fromMap(Map<String, Object> data) {
        PipelineConfig config = new PipelineConfig();

        if (data.containsKey("paths")) {
            Map<String, Object> paths = (Map<String, Object>) data.get("paths");
            if (paths.containsKey("inputRoot")) {
                config.inputRoot = Path.of((String) paths.get("inputRoot"));
            }
            if (paths.containsKey("regionalOutputDir")) {
                config.regionalOutputDir = Path.of((String) paths.get("regionalOutputDir"));
            }
            if (paths.containsKey("outputDir")) {
                config.outputDir = Path.of((String) paths.get("outputDir"));
            }
            if (paths.containsKey("reportsDir")) {
                config.reportsDir = Path.of((String) paths.get("reportsDir"));
            }
        }

        if (data.containsKey("csv")) {
            Map<String, Object> csv = (Map<String, Object>) data.get("csv");
            if (csv.containsKey("delimiter")) {
                String delimiter = String.valueOf(csv.get("delimiter"));
                if (delimiter.length() != 1) {
                    throw new ConfigurationException("csv.delimiter must be a single character: '" + delimiter + "'");
                }
                config.delimiter = delimiter.charAt(0);
            }
            if (csv.containsKey("encoding")) {
                config.encoding = parseCharset((String) csv.get("encoding"));
            }
        }

        if (data.containsKey("extraction")) {
            Map<String, Object> extraction = (Map<String, Object>) data.get("extraction");

            if (extraction.containsKey("regions")) {
                config.regions = toStringList(extraction.get("regions"));
            }
            if (extraction.containsKey("subjectCodeColumn")) {
                config.subjectCodeColumn = (String) extraction.get("subjectCodeColumn");
            }
            if (extraction.containsKey("subjectCodes")) {
                Set<Integer> codes = new LinkedHashSet<>();
                for (Object code : (List<Object>) extraction.get("subjectCodes")) {
                    codes.add(((Number) code).intValue());
                }
                config.subjectCodes = codes;
            }
            if (extraction.containsKey("projectedColumns")) {
                config.projectedColumns = toStringList(extraction.get("projectedColumns"));
            }
            if (extraction.containsKey("neutralMarker")) {
                Object marker = extraction.get("neutralMarker");
                config.neutralMarker = marker == null ? "" : String.valueOf(marker);
            }
            if (extraction.containsKey("strictSchema")) {
                config.strictSchema = (Boolean) extraction.get("strictSchema");
            }
        }

        if (data.containsKey("analysis")) {
            Map<String, Object> analysis = (Map<String, Object>) data.get("analysis");

            if (analysis.containsKey("columns")) {
                config.analysisColumns = toStringList(analysis.get("columns"));
            }
            if (analysis.containsKey("processNumberColumn")) {
                config.processNumberColumn = (String) analysis.get("processNumberColumn");
            }
            if (analysis.containsKey("defendantNatureColumn")) {
                config.defendantNatureColumn = (String) analysis.get("defendantNatureColumn");
            }
            if (analysis.containsKey("publicEntityKeywords")) {
                config.publicEntityKeywords = toStringList(analysis.get("publicEntityKeywords"));
            }
            if (analysis.containsKey("multiValued")) {
                config.multiValued = (Boolean) analysis.get("multiValued");
            }
            if (analysis.containsKey("includeRegional")) {
                config.includeRegional = (Boolean) analysis.get("includeRegional");
            }
        }

        if (data.containsKey("report")) {
            Map<String, Object> report = (Map<String, Object>) data.get("report");

            if (report.containsKey("baseName")) {
                config.reportBaseName = (String) report.get("baseName");
            }
            if (report.containsKey("topN")) {
                config.topN = (Integer) report.get("topN");
            }
            if (report.containsKey("publicDefendantStartPage")) {
                config.publicDefendantStartPage = (Integer) report.get("publicDefendantStartPage");
            }
            if (report.containsKey("pdf")) {
                config.pdfEnabled = (Boolean) report.get("pdf");
            }
        }

        return config;
    }

    private static List<String> toStringList(Object value) {
        List<String> result = new ArrayList<>();
        for (Object item : (List<?>) value) {
            result.add(String.valueOf(item));
        }
        return result;
    }

    private static Charset parseCharset(String name) {
        try {
            return Charset.forName(name);
        } catch (IllegalCharsetNameException | UnsupportedCharsetException e) {
            throw new ConfigurationException("Unsupported csv.encoding: " + name, e);
        }
    }

    /**
     * Checks the directories pipeline 1 needs. The input root must exist; output
     * directories are created when absent.
     *
     * @throws ConfigurationException if the input root is missing or an output path is not a directory
     */
    public void validateForExtraction() {
        if (!Files.isDirectory(inputRoot)) {
            throw new ConfigurationException("Input directory not found: " + inputRoot.toAbsolutePath());
        }
        ensureDirectory(regionalOutputDir, "regional output");
        ensureDirectory(outputDir, "output");
    }

    /**
     * Checks the directories the standalone consolidation step needs.
     */
    public void validateForConsolidation() {
        if (!Files.isDirectory(regionalOutputDir)) {
            throw new ConfigurationException("Regional output directory not found: "
                + regionalOutputDir.toAbsolutePath());
        }
        ensureDirectory(outputDir, "output");
    }

    /**
     * Checks the inputs and directories pipeline 2 needs.
     *
     * @throws ConfigurationException if the consolidated file has not been produced yet
     */
    public void validateForAnalysis() {
        Path consolidated = getConsolidatedFile();
        if (!Files.isRegularFile(consolidated)) {
            throw new ConfigurationException("Consolidated file not found: " + consolidated.toAbsolutePath()
                + " (run 'extract' first)");
        }
        ensureDirectory(reportsDir, "reports");
    }

    private static void ensureDirectory(Path dir, String role) {
        if (Files.exists(dir) && !Files.isDirectory(dir)) {
            throw new ConfigurationException("The " + role + " path is not a directory: " + dir.toAbsolutePath());
        }
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new ConfigurationException("Cannot create " + role + " directory: " + dir.toAbsolutePath(), e);
        }
    }

    public Path getConsolidatedFile() {
        return outputDir.resolve(CONSOLIDATED_BASE_NAME + CSV_EXTENSION);
    }

    public Path getRegionalFile(String groupName) {
        return regionalOutputDir.resolve(REGIONAL_FILE_PREFIX + groupName + CSV_EXTENSION);
    }

    /**
     * Lists the persisted regional files of the configured regions, in region order, which is the
     * order extraction discovers the groups in. Other {@code dados_saude_*.csv} files in the
     * directory are left out with a warning.
     */
    public List<Path> listRegionalFiles() throws IOException {
        if (!Files.isDirectory(regionalOutputDir)) {
            return List.of();
        }
        List<Path> regionalFiles = new ArrayList<>();
        for (String region : regions) {
            Path file = getRegionalFile(region);
            if (Files.isRegularFile(file)) {
                regionalFiles.add(file);
            } else {
                log.debug("No regional file for {} in {}", region, regionalOutputDir);
            }
        }
        try (Stream<Path> files = Files.list(regionalOutputDir)) {
            files.filter(Files::isRegularFile)
                .filter(file -> {
                    String name = file.getFileName().toString();
                    return name.startsWith(REGIONAL_FILE_PREFIX) && name.endsWith(CSV_EXTENSION);
                })
                .filter(file -> !regionalFiles.contains(file))
                .sorted()
                .forEach(file -> log.warn("Ignoring {}: {} is not one of the configured regions {}",
                    file.getFileName(), groupNameOf(file), regions));
        }
        return regionalFiles;
    }

    /**
     * Recovers the group name from a regional file name, {@code dados_saude_NE.csv -> NE}.
     */
    public static String groupNameOf(Path regionalFile) {
        String name = regionalFile.getFileName().toString();
        if (name.startsWith(REGIONAL_FILE_PREFIX)) {
            name = name.substring(REGIONAL_FILE_PREFIX.length());
        }
        if (name.endsWith(CSV_EXTENSION)) {
            name = name.substring(0, name.length() - CSV_EXTENSION.length());
        }
        return name;
    }

    public CsvDialect getCsvDialect() {
        return new CsvDialect(delimiter, encoding);
    }

    // Getters and setters
    public Path getInputRoot() {
        return inputRoot;
    }

    public void setInputRoot(Path inputRoot) {
        this.inputRoot = inputRoot;
    }

    public Path getRegionalOutputDir() {
        return regionalOutputDir;
    }

    public void setRegionalOutputDir(Path regionalOutputDir) {
        this.regionalOutputDir = regionalOutputDir;
    }

    public Path getOutputDir() {
        return outputDir;
    }

    public void setOutputDir(Path outputDir) {
        this.outputDir = outputDir;
    }

    public Path getReportsDir() {
        return reportsDir;
    }

    public void setReportsDir(Path reportsDir) {
        this.reportsDir = reportsDir;
    }

    public char getDelimiter() {
        return delimiter;
    }

    public void setDelimiter(char delimiter) {
        this.delimiter = delimiter;
    }

    public Charset getEncoding() {
        return encoding;
    }

    public void setEncoding(Charset encoding) {
        this.encoding = encoding;
    }

    public List<String> getRegions() {
        return regions;
    }

    public void setRegions(List<String> regions) {
        this.regions = regions;
    }

    public String getSubjectCodeColumn() {
        return subjectCodeColumn;
    }

    public void setSubjectCodeColumn(String subjectCodeColumn) {
        this.subjectCodeColumn = subjectCodeColumn;
    }

    public Set<Integer> getSubjectCodes() {
        return subjectCodes;
    }

    public void setSubjectCodes(Set<Integer> subjectCodes) {
        this.subjectCodes = subjectCodes;
    }

    public List<String> getProjectedColumns() {
        return projectedColumns;
    }

    public void setProjectedColumns(List<String> projectedColumns) {
        this.projectedColumns = projectedColumns;
    }

    public String getNeutralMarker() {
        return neutralMarker;
    }

    public void setNeutralMarker(String neutralMarker) {
        this.neutralMarker = neutralMarker;
    }

    public boolean isStrictSchema() {
        return strictSchema;
    }

    public void setStrictSchema(boolean strictSchema) {
        this.strictSchema = strictSchema;
    }

    public List<String> getAnalysisColumns() {
        return analysisColumns;
    }

    public void setAnalysisColumns(List<String> analysisColumns) {
        this.analysisColumns = analysisColumns;
    }

    public String getProcessNumberColumn() {
        return processNumberColumn;
    }

    public void setProcessNumberColumn(String processNumberColumn) {
        this.processNumberColumn = processNumberColumn;
    }

    public String getDefendantNatureColumn() {
        return defendantNatureColumn;
    }

    public void setDefendantNatureColumn(String defendantNatureColumn) {
        this.defendantNatureColumn = defendantNatureColumn;
    }

    public List<String> getPublicEntityKeywords() {
        return publicEntityKeywords;
    }

    public void setPublicEntityKeywords(List<String> publicEntityKeywords) {
        this.publicEntityKeywords = publicEntityKeywords;
    }

    public boolean isMultiValued() {
        return multiValued;
    }

    public void setMultiValued(boolean multiValued) {
        this.multiValued = multiValued;
    }

    public boolean isIncludeRegional() {
        return includeRegional;
    }

    public void setIncludeRegional(boolean includeRegional) {
        this.includeRegional = includeRegional;
    }

    public String getReportBaseName() {
        return reportBaseName;
    }

    public void setReportBaseName(String reportBaseName) {
        this.reportBaseName = reportBaseName;
    }

    public int getTopN() {
        return topN;
    }

    public void setTopN(int topN) {
        this.topN = topN;
    }

    public int getPublicDefendantStartPage() {
        return publicDefendantStartPage;
    }

    public void setPublicDefendantStartPage(int publicDefendantStartPage) {
        this.publicDefendantStartPage = publicDefendantStartPage;
    }

    public boolean isPdfEnabled() {
        return pdfEnabled;
    }

    public void setPdfEnabled(boolean pdfEnabled) {
        this.pdfEnabled = pdfEnabled;
    }

    public boolean isQuiet() {
        return quiet;
    }

    public void setQuiet(boolean quiet) {
        this.quiet = quiet;
    }
}
