package my.architrack.app.repository;

import my.architrack.app.domain.ItemizedStatement;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

public interface ItemizedStatementRepository extends JpaRepository<ItemizedStatement, Long> {
	Optional<ItemizedStatement> findByItemizedStatementIdAndDeletedAtIsNull(Long itemizedStatementId);

	boolean existsByProjectIdAndNameAndDeletedAtIsNull(Long projectId, String name);

	long countByProjectIdAndDeletedAtIsNull(Long projectId);

	Page<ItemizedStatement> findByProjectIdAndDeletedAtIsNull(Long projectId, Pageable pageable);

	List<ItemizedStatement> findByProjectIdAndDeletedAtIsNullOrderByCreatedAtDescItemizedStatementIdDesc(Long projectId, Pageable pageable);

	@Query("select s from ItemizedStatement s "
			+ "where s.projectId = :projectId and s.deletedAt is null "
			+ "and (lower(s.name) like :pattern or lower(s.sourceQuantityTableName) like :pattern)")
	Page<ItemizedStatement> searchActive(@Param("projectId") Long projectId,
										 @Param("pattern") String pattern,
										 Pageable pageable);

	@Modifying(clearAutomatically = true, flushAutomatically = true)
	@Query("update ItemizedStatement s "
			+ "set s.deletedAt = :now, s.updatedAt = :now, s.activeName = null, s.version = s.version + 1 "
			+ "where s.itemizedStatementId = :id and s.version = :version and s.deletedAt is null")
	int markDeleted(@Param("id") Long id, @Param("version") long version, @Param("now") LocalDateTime now);
}
