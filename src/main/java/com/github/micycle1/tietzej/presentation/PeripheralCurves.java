package com.github.micycle1.tietzej.presentation;

import java.util.Objects;

import com.github.micycle1.tietzej.word.Word;

/**
 * Meridian and longitude of one cusp, as words in the current generators. Both
 * come from the kernel and are passed through as they are.
 */
public final class PeripheralCurves {

	private final int cusp;
	private final Word meridian;
	private final Word longitude;

	public PeripheralCurves(int cusp, Word meridian, Word longitude) {
		this.cusp = cusp;
		this.meridian = Objects.requireNonNull(meridian, "meridian");
		this.longitude = Objects.requireNonNull(longitude, "longitude");
	}

	public int getCusp() {
		return cusp;
	}

	public Word getMeridian() {
		return meridian;
	}

	public Word getLongitude() {
		return longitude;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof PeripheralCurves)) {
			return false;
		}
		PeripheralCurves other = (PeripheralCurves) o;
		return cusp == other.cusp && meridian.equals(other.meridian) && longitude.equals(other.longitude);
	}

	@Override
	public int hashCode() {
		return Objects.hash(cusp, meridian, longitude);
	}

	@Override
	public String toString() {
		return "PeripheralCurves{cusp=" + cusp + ", meridian=" + meridian + ", longitude=" + longitude + "}";
	}
}
