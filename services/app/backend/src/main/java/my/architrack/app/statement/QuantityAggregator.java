package my.architrack.app.statement;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Groups quantity items by their {@link GroupKey} and sums the quantities.
 * <p>
 * Sums are exact {@link BigDecimal} values; every accumulation step is checked against
 * [{@link #MIN_QUANTITY}, {@link #MAX_QUANTITY}] and the final sums are rounded to two places.
 * Output rows come in {@link #DEFAULT_ORDER}.
 */
public class QuantityAggregator {
	public static final int SCALE = 2;
	public static final BigDecimal MIN_QUANTITY = new BigDecimal("-999999.99");
	public static final BigDecimal MAX_QUANTITY = new BigDecimal("9999999.99");

	public static final Comparator<StatementRow> DEFAULT_ORDER = StatementColumn.CUSTOM_CATEGORY.ascending()
			.thenComparing(StatementColumn.WORK_TYPE.ascending())
			.thenComparing(StatementColumn.NAME.ascending())
			.thenComparing(StatementColumn.SPECIFICATION.ascending());

	public AggregationResult aggregate(List<QuantityItemView> items) {
		Map<GroupKey, Accumulator> sums = new LinkedHashMap<>();
		for (QuantityItemView item : items) {
			GroupKey key = GroupKey.of(item);
			sums.computeIfAbsent(key, ignored -> new Accumulator()).add(item.quantity());
		}
		List<StatementRow> rows = new ArrayList<>(sums.size());
		for (Map.Entry<GroupKey, Accumulator> entry : sums.entrySet()) {
			rows.add(StatementRow.of(entry.getKey(), entry.getValue().rounded()));
		}
		// List.sort is stable: rows equal on the four sort keys stay in first-seen order.
		rows.sort(DEFAULT_ORDER);
		return new AggregationResult(List.copyOf(rows), items.size());
	}

	private static class Accumulator {
		private BigDecimal sum = BigDecimal.ZERO;

		private void add(BigDecimal quantity) {
			if (quantity == null) {
				return;
			}
			sum = sum.add(quantity);
			if (sum.compareTo(MIN_QUANTITY) < 0 || sum.compareTo(MAX_QUANTITY) > 0) {
				throw new QuantityOverflowException(sum, MIN_QUANTITY, MAX_QUANTITY);
			}
		}

		private BigDecimal rounded() {
			return sum.setScale(SCALE, RoundingMode.HALF_UP);
		}
	}

	public record AggregationResult(List<StatementRow> rows, int sourceItemCount) {
		public boolean isEmpty() {
			return rows.isEmpty();
		}
	}
}
