package io.gitfort.insights;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Scans the default branch of repositories for committed secrets.
 *
 * <p>
 * Files are selected from the recursive tree, fetched one at a time through the request
 * engine and scanned line by line. A file that cannot be fetched is skipped.
 */
public class RepositoryScanService {

	private static final Logger logger = LoggerFactory.getLogger(RepositoryScanService.class);

	private final RestService restService;

	private final ContentSecurityScanner scanner;

	private final NotificationListener listener;

	private final Clock clock;

	private final int alertThreshold;

	public RepositoryScanService(RestService restService, ContentSecurityScanner scanner,
			NotificationListener listener, Clock clock, int alertThreshold) {
		this.restService = restService;
		this.scanner = scanner;
		this.listener = listener;
		this.clock = clock;
		this.alertThreshold = alertThreshold;
	}

	/**
	 * Scan one repository. A {@link NotificationType#SECURITY_ALERT} is published when the
	 * risk score reaches the alert threshold.
	 * @param owner repository owner
	 * @param repo repository name
	 * @param options file selection
	 * @return the report
	 * @throws GitHubException if the tree cannot be listed
	 */
	public RepositoryScanReport scanRepository(String owner, String repo, ScanOptions options) {
		String repository = owner + "/" + repo;
		List<TreeEntry> tree = restService.getRepositoryTree(owner, repo);
		List<TreeEntry> selected = selectFiles(tree, options);
		logger.info("Scanning {} of {} files in {}", selected.size(), tree.size(), repository);

		List<FileContent> files = new ArrayList<>();
		for (TreeEntry entry : selected) {
			try {
				String content = restService.getRepositoryContent(owner, repo, entry.path());
				files.add(new FileContent(entry.path(), content, entry.size() > 0 ? entry.size() : content.length()));
			}
			catch (GitHubException e) {
				logger.warn("Skipping {} in {}: {}", entry.path(), repository, e.getMessage());
			}
		}

		ScanResult result = scanner.scan(files, tree.size());
		RepositoryScanReport report = new RepositoryScanReport(repository, result, 100 - result.riskScore(),
				clock.instant());
		logger.info("Scan of {} found {} vulnerabilities, risk score {}", repository,
				result.vulnerabilities().size(), result.riskScore());
		if (result.riskScore() >= alertThreshold) {
			publishAlert(report);
		}
		return report;
	}

	/**
	 * Scan several repositories. A repository that cannot be scanned is logged and left out.
	 * @param fullNames "owner/repo" names
	 * @param options file selection
	 * @return reports of the repositories that were scanned, in input order
	 */
	public List<RepositoryScanReport> scanRepositories(List<String> fullNames, ScanOptions options) {
		List<RepositoryScanReport> reports = new ArrayList<>();
		for (String fullName : fullNames) {
			String[] parts = fullName.split("/", 2);
			if (parts.length != 2 || parts[0].isEmpty() || parts[1].isEmpty()) {
				logger.warn("Skipping invalid repository name: {}", fullName);
				continue;
			}
			try {
				reports.add(scanRepository(parts[0], parts[1], options));
			}
			catch (GitHubException e) {
				logger.warn("Scan of {} failed: {}", fullName, e.getMessage());
			}
		}
		return reports;
	}

	/**
	 * Blobs passing the exclude and include globs, capped at the file limit, without those
	 * above the size limit.
	 * @param tree tree entries
	 * @param options selection options
	 * @return files to fetch
	 */
	List<TreeEntry> selectFiles(List<TreeEntry> tree, ScanOptions options) {
		List<GlobMatcher> excludes = GlobMatcher.compile(options.excludePatterns());
		List<GlobMatcher> includes = GlobMatcher.compile(options.includePatterns());
		Set<String> seen = new LinkedHashSet<>();
		return tree.stream()
			.filter(entry -> !GlobMatcher.anyMatch(excludes, entry.path()))
			.filter(entry -> GlobMatcher.anyMatch(includes, entry.path()))
			.limit(options.maxFiles())
			.filter(entry -> entry.size() <= options.maxFileSize())
			.filter(entry -> seen.add(entry.path()))
			.toList();
	}

	private void publishAlert(RepositoryScanReport report) {
		ScanResult result = report.result();
		Map<String, Object> payload = new LinkedHashMap<>();
		payload.put("riskScore", result.riskScore());
		payload.put("securityScore", report.securityScore());
		payload.put("vulnerabilities", result.vulnerabilities().size());
		payload.put("critical", result.count(Severity.CRITICAL));
		payload.put("high", result.count(Severity.HIGH));
		listener.onEvent(new NotificationEvent(NotificationType.SECURITY_ALERT, report.repository(), payload,
				report.scannedAt()));
		logger.warn("Security alert for {}: risk score {}", report.repository(), result.riskScore());
	}

}
