package com.github.micycle1.tietzej.kernel;

import java.util.Objects;

/**
 * Flags controlling how the kernel simplifies a presentation. The library never
 * interprets them; they are forwarded to {@link PresentationKernel} as set. All
 * default to <code>true</code>.
 */
public final class SimplificationOptions {

	private final boolean simplifyPresentation;
	private final boolean fillingsMayAffectGenerators;
	private final boolean minimizeNumberOfGenerators;
	private final boolean tryHardToShortenRelators;

	private SimplificationOptions(Builder builder) {
		this.simplifyPresentation = builder.simplifyPresentation;
		this.fillingsMayAffectGenerators = builder.fillingsMayAffectGenerators;
		this.minimizeNumberOfGenerators = builder.minimizeNumberOfGenerators;
		this.tryHardToShortenRelators = builder.tryHardToShortenRelators;
	}

	public static SimplificationOptions defaults() {
		return builder().build();
	}

	public static Builder builder() {
		return new Builder();
	}

	public boolean isSimplifyPresentation() {
		return simplifyPresentation;
	}

	public boolean isFillingsMayAffectGenerators() {
		return fillingsMayAffectGenerators;
	}

	public boolean isMinimizeNumberOfGenerators() {
		return minimizeNumberOfGenerators;
	}

	public boolean isTryHardToShortenRelators() {
		return tryHardToShortenRelators;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof SimplificationOptions)) {
			return false;
		}
		SimplificationOptions other = (SimplificationOptions) o;
		return simplifyPresentation == other.simplifyPresentation && fillingsMayAffectGenerators == other.fillingsMayAffectGenerators
				&& minimizeNumberOfGenerators == other.minimizeNumberOfGenerators && tryHardToShortenRelators == other.tryHardToShortenRelators;
	}

	@Override
	public int hashCode() {
		return Objects.hash(simplifyPresentation, fillingsMayAffectGenerators, minimizeNumberOfGenerators, tryHardToShortenRelators);
	}

	@Override
	public String toString() {
		return "SimplificationOptions{simplify=" + simplifyPresentation + ", fillingsMayAffectGenerators=" + fillingsMayAffectGenerators
				+ ", minimizeGenerators=" + minimizeNumberOfGenerators + ", tryHardToShortenRelators=" + tryHardToShortenRelators + "}";
	}

	public static final class Builder {

		private boolean simplifyPresentation = true;
		private boolean fillingsMayAffectGenerators = true;
		private boolean minimizeNumberOfGenerators = true;
		private boolean tryHardToShortenRelators = true;

		private Builder() {
		}

		public Builder simplifyPresentation(boolean value) {
			this.simplifyPresentation = value;
			return this;
		}

		public Builder fillingsMayAffectGenerators(boolean value) {
			this.fillingsMayAffectGenerators = value;
			return this;
		}

		public Builder minimizeNumberOfGenerators(boolean value) {
			this.minimizeNumberOfGenerators = value;
			return this;
		}

		public Builder tryHardToShortenRelators(boolean value) {
			this.tryHardToShortenRelators = value;
			return this;
		}

		public SimplificationOptions build() {
			return new SimplificationOptions(this);
		}
	}
}
