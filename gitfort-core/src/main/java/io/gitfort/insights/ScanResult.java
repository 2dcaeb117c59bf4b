package io.gitfort.insights;

import java.util.List;

/**
 * Outcome of scanning a set of files.
 *
 * @param vulnerabilities findings in file and line order
 * @param riskScore 0 (nothing found) to 100
 * @param scannedFiles files whose content was scanned
 * @param totalFiles files in the repository tree
 */
public record ScanResult(List<Vulnerability> vulnerabilities, int riskScore, int scannedFiles, int totalFiles) {

	public ScanResult {
		vulnerabilities = List.copyOf(vulnerabilities);
	}

	public long count(Severity severity) {
		return vulnerabilities.stream().filter(vulnerability -> vulnerability.severity() == severity).count();
	}

}
