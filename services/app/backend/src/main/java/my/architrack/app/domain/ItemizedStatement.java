package my.architrack.app.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.Version;

import java.time.LocalDateTime;

@Entity
@Table(name = "itemized_statements")
public class ItemizedStatement {
	@Id
	@GeneratedValue(strategy = GenerationType.IDENTITY)
	@Column(name = "itemized_statement_id")
	private Long itemizedStatementId;

	@Column(name = "project_id", nullable = false, updatable = false)
	private Long projectId;

	@Column(name = "name", nullable = false, updatable = false, length = 200)
	private String name;

	/**
	 * Copy of {@link #name} while the statement is live, {@code null} once deleted. Backs the
	 * per-project unique constraint on active names.
	 */
	@Column(name = "active_name", length = 200)
	private String activeName;

	@Column(name = "source_quantity_table_id", nullable = false, updatable = false)
	private Long sourceQuantityTableId;

	@Column(name = "source_quantity_table_name", nullable = false, updatable = false)
	private String sourceQuantityTableName;

	@Column(name = "item_count", nullable = false, updatable = false)
	private int itemCount;

	@Column(name = "created_by", updatable = false)
	private String createdBy;

	@Column(name = "created_at", nullable = false, updatable = false)
	private LocalDateTime createdAt;

	@Column(name = "updated_at", nullable = false)
	private LocalDateTime updatedAt;

	@Column(name = "deleted_at")
	private LocalDateTime deletedAt;

	@Version
	@Column(name = "version", nullable = false)
	private long version;

	public Long getItemizedStatementId() {
		return itemizedStatementId;
	}

	public void setItemizedStatementId(Long itemizedStatementId) {
		this.itemizedStatementId = itemizedStatementId;
	}

	public Long getProjectId() {
		return projectId;
	}

	public void setProjectId(Long projectId) {
		this.projectId = projectId;
	}

	public String getName() {
		return name;
	}

	public void setName(String name) {
		this.name = name;
	}

	public String getActiveName() {
		return activeName;
	}

	public void setActiveName(String activeName) {
		this.activeName = activeName;
	}

	public Long getSourceQuantityTableId() {
		return sourceQuantityTableId;
	}

	public void setSourceQuantityTableId(Long sourceQuantityTableId) {
		this.sourceQuantityTableId = sourceQuantityTableId;
	}

	public String getSourceQuantityTableName() {
		return sourceQuantityTableName;
	}

	public void setSourceQuantityTableName(String sourceQuantityTableName) {
		this.sourceQuantityTableName = sourceQuantityTableName;
	}

	public int getItemCount() {
		return itemCount;
	}

	public void setItemCount(int itemCount) {
		this.itemCount = itemCount;
	}

	public String getCreatedBy() {
		return createdBy;
	}

	public void setCreatedBy(String createdBy) {
		this.createdBy = createdBy;
	}

	public LocalDateTime getCreatedAt() {
		return createdAt;
	}

	public void setCreatedAt(LocalDateTime createdAt) {
		this.createdAt = createdAt;
	}

	public LocalDateTime getUpdatedAt() {
		return updatedAt;
	}

	public void setUpdatedAt(LocalDateTime updatedAt) {
		this.updatedAt = updatedAt;
	}

	public LocalDateTime getDeletedAt() {
		return deletedAt;
	}

	public void setDeletedAt(LocalDateTime deletedAt) {
		this.deletedAt = deletedAt;
	}

	public long getVersion() {
		return version;
	}

	public void setVersion(long version) {
		this.version = version;
	}

	public boolean isDeleted() {
		return deletedAt != null;
	}
}
