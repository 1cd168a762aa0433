package my.architrack.app.service;

import my.architrack.app.statement.QuantityItemView;

import java.util.List;
import java.util.Optional;

/**
 * Read-only access to quantity tables owned by the quantity table editor.
 */
public interface QuantityTableReader {
	Optional<QuantityTableSource> findTable(Long quantityTableId);

	List<QuantityItemView> readItems(Long quantityTableId);

	record QuantityTableSource(Long id, Long projectId, String name) {
	}
}
