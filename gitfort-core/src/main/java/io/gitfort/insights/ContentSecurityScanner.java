package io.gitfort.insights;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;

/**
 * Line-oriented secret detection and risk scoring. Stateless.
 *
 * <p>
 * The risk score sums, per finding, the severity weight times the family multiplier, then
 * adds a flat penalty per finding of medium severity or above. It is rounded half-up and
 * capped at 100.
 */
public class ContentSecurityScanner {

	private static final Map<Severity, Integer> WEIGHTS = Map.of(Severity.LOW, 1, Severity.MEDIUM, 3, Severity.HIGH,
			7, Severity.CRITICAL, 15);

	private static final Map<Severity, Integer> PENALTIES = Map.of(Severity.LOW, 0, Severity.MEDIUM, 2,
			Severity.HIGH, 5, Severity.CRITICAL, 10);

	private static final int MAX_SCORE = 100;

	private final List<SecretDetector> detectors;

	public ContentSecurityScanner() {
		this(SecretDetectors.ALL);
	}

	public ContentSecurityScanner(List<SecretDetector> detectors) {
		this.detectors = List.copyOf(detectors);
	}

	/**
	 * Scan the files and score the findings.
	 * @param files fetched files
	 * @param totalFiles number of files in the repository tree
	 * @return findings and score
	 */
	public ScanResult scan(List<FileContent> files, int totalFiles) {
		List<Vulnerability> vulnerabilities = new ArrayList<>();
		for (FileContent file : files) {
			vulnerabilities.addAll(scanFile(file));
		}
		return new ScanResult(vulnerabilities, calculateRiskScore(vulnerabilities), files.size(), totalFiles);
	}

	public List<Vulnerability> scanFile(FileContent file) {
		List<Vulnerability> vulnerabilities = new ArrayList<>();
		String[] lines = file.content().split("\n", -1);
		for (int i = 0; i < lines.length; i++) {
			vulnerabilities.addAll(scanLine(lines[i], file.path(), i + 1));
		}
		return vulnerabilities;
	}

	/**
	 * Apply every detector to one line. A detector reports each non-overlapping match its
	 * validator accepts.
	 * @param line text of the line
	 * @param path file path
	 * @param lineNumber 1-based line number
	 * @return findings in detector order
	 */
	public List<Vulnerability> scanLine(String line, String path, int lineNumber) {
		List<Vulnerability> vulnerabilities = new ArrayList<>();
		for (SecretDetector detector : detectors) {
			Matcher matcher = detector.pattern().matcher(line);
			while (matcher.find()) {
				if (detector.accepts(matcher.group())) {
					vulnerabilities.add(new Vulnerability(path, lineNumber, detector.type(), detector.severity(),
							detector.description(), detector.type().getSuggestion()));
				}
			}
		}
		return vulnerabilities;
	}

	public int calculateRiskScore(List<Vulnerability> vulnerabilities) {
		BigDecimal total = BigDecimal.ZERO;
		for (Vulnerability vulnerability : vulnerabilities) {
			BigDecimal weighted = BigDecimal.valueOf(WEIGHTS.get(vulnerability.severity()))
				.multiply(BigDecimal.valueOf(vulnerability.type().getMultiplier()));
			total = total.add(weighted).add(BigDecimal.valueOf(PENALTIES.get(vulnerability.severity())));
		}
		int rounded = total.setScale(0, RoundingMode.HALF_UP).intValue();
		return Math.max(0, Math.min(rounded, MAX_SCORE));
	}

}
