package io.gitfort.insights;

/**
 * Family of a detected secret. The multiplier scales the severity weight in the risk score.
 */
public enum VulnerabilityType {

	ENV_VAR(1.0, "Move sensitive values to environment variables or secure configuration"),

	API_KEY(1.2, "Store API keys in environment variables or secure key management systems"),

	AWS_KEY(1.5, "Use AWS IAM roles, environment variables, or AWS Secrets Manager"),

	PRIVATE_KEY(2.0, "Remove private keys from repository and use secure key management");

	private final double multiplier;

	private final String suggestion;

	VulnerabilityType(double multiplier, String suggestion) {
		this.multiplier = multiplier;
		this.suggestion = suggestion;
	}

	public double getMultiplier() {
		return multiplier;
	}

	public String getSuggestion() {
		return suggestion;
	}

}
