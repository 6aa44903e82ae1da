package rtt.model;

public enum TargetSyntax {
	C("C"),
	JAVA("Java");

	private final String displayName;

	TargetSyntax(String displayName) {
		this.displayName = displayName;
	}

	public String displayName() {
		return displayName;
	}
}
