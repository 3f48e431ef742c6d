package org.translationsanalyzer;

/**
 * Kind of monorepo package owning a translation file. Used for display grouping only; the
 * duplication analysis never looks at it.
 */
public enum PackageType {

	APP, MODULE;

	/**
	 * Map a project marker segment to a package type. {@code apps} maps to {@link #APP};
	 * {@code modules} and any other configured marker map to {@link #MODULE}.
	 * @param marker the marker directory name, e.g. {@code apps}
	 * @return the package type
	 */
	public static PackageType fromMarker(String marker) {
		return "apps".equals(marker) ? APP : MODULE;
	}

}
