package my.architrack.app.statement;

import java.math.BigDecimal;

public record StatementRow(
		String customCategory,
		String workType,
		String name,
		String specification,
		String unit,
		BigDecimal quantity
) {
	public StatementRow {
		customCategory = GroupKey.normalize(customCategory);
		workType = GroupKey.normalize(workType);
		name = GroupKey.normalize(name);
		specification = GroupKey.normalize(specification);
		unit = GroupKey.normalize(unit);
	}

	public static StatementRow of(GroupKey key, BigDecimal quantity) {
		return new StatementRow(key.customCategory(), key.workType(), key.name(), key.specification(), key.unit(),
				quantity);
	}
}
