package my.architrack.app.service;

import my.architrack.app.domain.QuantityItem;
import my.architrack.app.repository.QuantityItemRepository;
import my.architrack.app.repository.QuantityTableRepository;
import my.architrack.app.statement.QuantityItemView;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

@Service
@Transactional(readOnly = true)
public class JpaQuantityTableReader implements QuantityTableReader {
	private final QuantityTableRepository quantityTableRepository;
	private final QuantityItemRepository quantityItemRepository;

	public JpaQuantityTableReader(QuantityTableRepository quantityTableRepository,
								  QuantityItemRepository quantityItemRepository) {
		this.quantityTableRepository = quantityTableRepository;
		this.quantityItemRepository = quantityItemRepository;
	}

	@Override
	public Optional<QuantityTableSource> findTable(Long quantityTableId) {
		return quantityTableRepository.findByQuantityTableIdAndDeletedAtIsNull(quantityTableId)
				.map(table -> new QuantityTableSource(table.getQuantityTableId(), table.getProjectId(), table.getName()));
	}

	@Override
	public List<QuantityItemView> readItems(Long quantityTableId) {
		return quantityItemRepository.findByQuantityTableOrdered(quantityTableId).stream()
				.map(this::toView)
				.toList();
	}

	private QuantityItemView toView(QuantityItem item) {
		return new QuantityItemView(
				item.getQuantityItemId(),
				item.getCustomCategory(),
				item.getWorkType(),
				item.getName(),
				item.getSpecification(),
				item.getUnit(),
				item.getQuantity()
		);
	}
}
