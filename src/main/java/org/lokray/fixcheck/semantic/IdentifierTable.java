package org.lokray.fixcheck.semantic;

import org.lokray.fixcheck.error.UnknownIdentifierException;
import org.lokray.fixcheck.semantic.type.FixedPointType;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Identifier to type map for one file, plus the set of names declared as registers.
 * A register can be known without having a type (its range could not be sized and carries no annotation);
 * that is what lets the analyzer tell "missing annotation" apart from "unknown name".
 * <p>
 * Built once by {@link TypeDatabaseBuilder}; read-only afterwards.
 */
public final class IdentifierTable
{
	private final Map<String, FixedPointType> types;
	private final Set<String> knownRegisters;
	private final List<String> warnings;

	public IdentifierTable(Map<String, FixedPointType> types, Set<String> knownRegisters, List<String> warnings)
	{
		this.types = Collections.unmodifiableMap(new LinkedHashMap<>(types));
		this.knownRegisters = Collections.unmodifiableSet(new LinkedHashSet<>(knownRegisters));
		this.warnings = List.copyOf(warnings);
	}

	public static IdentifierTable of(Map<String, FixedPointType> types)
	{
		return new IdentifierTable(types, Set.of(), List.of());
	}

	/**
	 * @throws UnknownIdentifierException when {@code name} has no type
	 */
	public FixedPointType lookup(String name)
	{
		FixedPointType type = types.get(name);
		if (type == null)
		{
			throw new UnknownIdentifierException(name);
		}
		return type;
	}

	public boolean contains(String name)
	{
		return types.containsKey(name);
	}

	public boolean isKnownRegister(String name)
	{
		return knownRegisters.contains(name);
	}

	public Map<String, FixedPointType> getTypes()
	{
		return types;
	}

	public Set<String> getKnownRegisters()
	{
		return knownRegisters;
	}

	/**
	 * Non-fatal declaration warnings, such as a range width that disagrees with the comment's type.
	 */
	public List<String> getWarnings()
	{
		return warnings;
	}
}
