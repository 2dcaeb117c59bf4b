package io.gitfort.insights;

import java.time.Instant;

/**
 * Scan of one repository.
 *
 * @param repository "owner/repo"
 * @param result findings and risk score
 * @param securityScore {@code 100 - riskScore}
 * @param scannedAt when the scan finished
 */
public record RepositoryScanReport(String repository, ScanResult result, int securityScore, Instant scannedAt) {

	public int riskScore() {
		return result.riskScore();
	}

}
