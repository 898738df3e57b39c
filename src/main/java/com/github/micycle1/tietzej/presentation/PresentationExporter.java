package com.github.micycle1.tietzej.presentation;

import java.util.List;
import java.util.stream.Collectors;

import org.apache.commons.lang3.StringUtils;

/**
 * Writes a presentation in the input syntax of third-party algebra systems.
 * Generators are the rendered generator names and relators are rendered in
 * verbose form, so the output is plain string formatting. An empty (identity)
 * relator is written as the identity of the target system.
 */
public final class PresentationExporter {

	private PresentationExporter() {
	}

	/**
	 * Magma: <code>Group&lt;a,b|a*b*a^-1*b^-1&gt;</code>.
	 */
	public static String magma(List<String> generators, List<String> verboseRelators) {
		List<String> relators = verboseRelators.stream().map(r -> StringUtils.defaultIfEmpty(r, "1")).collect(Collectors.toList());
		return "Group<" + StringUtils.join(generators, ',') + "|" + StringUtils.join(relators, ',') + ">";
	}

	/**
	 * GAP: a call that builds the free group on the generators, binds each
	 * generator name and returns the quotient by the relators.
	 */
	public static String gap(List<String> generators, List<String> verboseRelators) {
		StringBuilder sb = new StringBuilder("CallFuncList(function() local F");
		for (String g : generators) {
			sb.append(", ").append(g);
		}
		sb.append("; F := FreeGroup(");
		sb.append(generators.stream().map(g -> "\"" + g + "\"").collect(Collectors.joining(",")));
		sb.append("); ");
		for (int i = 0; i < generators.size(); i++) {
			sb.append(generators.get(i)).append(" := F.").append(i + 1).append("; ");
		}
		List<String> relators = verboseRelators.stream().map(r -> StringUtils.defaultIfEmpty(r, "One(F)")).collect(Collectors.toList());
		sb.append("return F/[").append(StringUtils.join(relators, ',')).append("]; end,[])");
		return sb.toString();
	}
}
