package my.architrack.app.statement;

/**
 * Composite key that merges quantity items into one statement row.
 * <p>
 * {@code null} and {@code ""} are the same value: both normalize to the empty string.
 */
public record GroupKey(
		String customCategory,
		String workType,
		String name,
		String specification,
		String unit
) {
	public static final String EMPTY = "";

	public GroupKey {
		customCategory = normalize(customCategory);
		workType = normalize(workType);
		name = normalize(name);
		specification = normalize(specification);
		unit = normalize(unit);
	}

	public static GroupKey of(QuantityItemView item) {
		return new GroupKey(item.customCategory(), item.workType(), item.name(), item.specification(), item.unit());
	}

	public static String normalize(String value) {
		return value == null ? EMPTY : value;
	}
}
