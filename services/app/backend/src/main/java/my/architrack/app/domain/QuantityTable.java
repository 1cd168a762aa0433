package my.architrack.app.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import org.hibernate.annotations.Immutable;

import java.time.LocalDateTime;

@Entity
@Immutable
@Table(name = "quantity_tables")
public class QuantityTable {
	@Id
	@Column(name = "quantity_table_id")
	private Long quantityTableId;

	@Column(name = "project_id", nullable = false)
	private Long projectId;

	@Column(name = "name", nullable = false)
	private String name;

	@Column(name = "deleted_at")
	private LocalDateTime deletedAt;

	public Long getQuantityTableId() {
		return quantityTableId;
	}

	public void setQuantityTableId(Long quantityTableId) {
		this.quantityTableId = quantityTableId;
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

	public LocalDateTime getDeletedAt() {
		return deletedAt;
	}

	public void setDeletedAt(LocalDateTime deletedAt) {
		this.deletedAt = deletedAt;
	}

	public boolean isDeleted() {
		return deletedAt != null;
	}
}
