package my.architrack.app.statement;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class QuantityAggregatorTest {
	private final QuantityAggregator aggregator = new QuantityAggregator();

	@Test
	void sumsItemsSharingTheSameKey() {
		List<QuantityItemView> items = List.of(
				item(1, "Structure", "Concrete", "Slab", "C30", "m3", "10.5"),
				item(2, "Structure", "Concrete", "Slab", "C30", "m3", "4.25"),
				item(3, "Structure", "Concrete", "Wall", "C30", "m3", "7"));

		QuantityAggregator.AggregationResult result = aggregator.aggregate(items);

		assertThat(result.sourceItemCount()).isEqualTo(3);
		assertThat(result.rows()).hasSize(2);
		assertThat(result.rows().get(0).name()).isEqualTo("Slab");
		assertThat(result.rows().get(0).quantity()).isEqualByComparingTo("14.75");
		assertThat(result.rows().get(1).quantity()).isEqualByComparingTo("7.00");
	}

	@Test
	void differentUnitsStaySeparate() {
		List<QuantityItemView> items = List.of(
				item(1, "A", "W", "N", "S", "m2", "1"),
				item(2, "A", "W", "N", "S", "m3", "2"));

		assertThat(aggregator.aggregate(items).rows()).hasSize(2);
	}

	@Test
	void nullAndEmptyTextMergeIntoOneRow() {
		List<QuantityItemView> items = List.of(
				item(1, null, "W", "N", null, "m", "1.10"),
				item(2, "", "W", "N", "", "m", "2.20"));

		QuantityAggregator.AggregationResult result = aggregator.aggregate(items);

		assertThat(result.rows()).hasSize(1);
		StatementRow row = result.rows().get(0);
		assertThat(row.customCategory()).isEmpty();
		assertThat(row.specification()).isEmpty();
		assertThat(row.quantity()).isEqualByComparingTo("3.30");
	}

	@Test
	void sumsAreExactAndRoundedToTwoPlaces() {
		List<QuantityItemView> items = new ArrayList<>();
		for (int i = 0; i < 10; i++) {
			items.add(item(i, "A", "W", "N", "S", "m", "0.1"));
		}
		items.add(item(99, "B", "W", "N", "S", "m", "0.005"));

		List<StatementRow> rows = aggregator.aggregate(items).rows();

		assertThat(rows.get(0).quantity()).isEqualTo(new BigDecimal("1.00"));
		assertThat(rows.get(1).quantity()).isEqualTo(new BigDecimal("0.01"));
	}

	@Test
	void nullQuantityCountsAsNothing() {
		List<QuantityItemView> items = List.of(
				item(1, "A", "W", "N", "S", "m", null),
				item(2, "A", "W", "N", "S", "m", "3"));

		QuantityAggregator.AggregationResult result = aggregator.aggregate(items);

		assertThat(result.rows()).hasSize(1);
		assertThat(result.rows().get(0).quantity()).isEqualByComparingTo("3");
	}

	@Test
	void defaultOrderPutsEmptyFirstAndComparesBytes() {
		List<QuantityItemView> items = List.of(
				item(1, "b", "W", "N", "S", "m", "1"),
				item(2, "B", "W", "N", "S", "m", "1"),
				item(3, "", "W", "N", "S", "m", "1"),
				item(4, "a", "W", "N", "S", "m", "1"));

		List<String> categories = aggregator.aggregate(items).rows().stream()
				.map(StatementRow::customCategory)
				.toList();

		assertThat(categories).containsExactly("", "B", "a", "b");
	}

	@Test
	void rowsTiedOnSortKeysKeepFirstSeenOrder() {
		List<QuantityItemView> items = List.of(
				item(1, "A", "W", "N", "S", "pcs", "1"),
				item(2, "A", "W", "N", "S", "kg", "1"),
				item(3, "A", "W", "N", "S", "m", "1"));

		List<String> units = aggregator.aggregate(items).rows().stream()
				.map(StatementRow::unit)
				.toList();

		assertThat(units).containsExactly("pcs", "kg", "m");
	}

	@Test
	void overflowAbovePrecisionIsRejected() {
		List<QuantityItemView> items = List.of(
				item(1, "A", "W", "N", "S", "m", "9999999.99"),
				item(2, "A", "W", "N", "S", "m", "0.01"));

		assertThatThrownBy(() -> aggregator.aggregate(items))
				.isInstanceOf(QuantityOverflowException.class)
				.satisfies(ex -> assertThat(((QuantityOverflowException) ex).getCode()).isEqualTo("QUANTITY_OVERFLOW"));
	}

	@Test
	void overflowBelowMinimumIsRejected() {
		List<QuantityItemView> items = List.of(item(1, "A", "W", "N", "S", "m", "-1000000"));

		assertThatThrownBy(() -> aggregator.aggregate(items))
				.isInstanceOf(QuantityOverflowException.class);
	}

	@Test
	void boundaryValuesAreAccepted() {
		List<QuantityItemView> items = List.of(
				item(1, "A", "W", "N", "S", "m", "9999999.99"),
				item(2, "B", "W", "N", "S", "m", "-999999.99"));

		assertThat(aggregator.aggregate(items).rows()).hasSize(2);
	}

	@Test
	void emptyInputGivesEmptyResult() {
		QuantityAggregator.AggregationResult result = aggregator.aggregate(List.of());

		assertThat(result.isEmpty()).isTrue();
		assertThat(result.sourceItemCount()).isZero();
	}

	static QuantityItemView item(long id, String category, String workType, String name, String spec, String unit,
								 String quantity) {
		return new QuantityItemView(id, category, workType, name, spec, unit,
				quantity == null ? null : new BigDecimal(quantity));
	}
}
