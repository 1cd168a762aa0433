package my.architrack.app.repository;

import my.architrack.app.domain.QuantityTable;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface QuantityTableRepository extends JpaRepository<QuantityTable, Long> {
	Optional<QuantityTable> findByQuantityTableIdAndDeletedAtIsNull(Long quantityTableId);
}
