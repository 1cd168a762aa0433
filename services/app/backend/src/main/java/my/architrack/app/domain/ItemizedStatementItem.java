package my.architrack.app.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import org.hibernate.annotations.Immutable;

import java.math.BigDecimal;

/**
 * One aggregated row of a statement. Rows are written once, together with their header.
 */
@Entity
@Immutable
@Table(name = "itemized_statement_items")
public class ItemizedStatementItem {
	@Id
	@GeneratedValue(strategy = GenerationType.IDENTITY)
	@Column(name = "item_id")
	private Long itemId;

	@Column(name = "itemized_statement_id", nullable = false)
	private Long itemizedStatementId;

	@Column(name = "custom_category")
	private String customCategory;

	@Column(name = "work_type")
	private String workType;

	@Column(name = "name")
	private String name;

	@Column(name = "specification")
	private String specification;

	@Column(name = "unit")
	private String unit;

	@Column(name = "quantity", nullable = false, precision = 10, scale = 2)
	private BigDecimal quantity;

	@Column(name = "display_order", nullable = false)
	private int displayOrder;

	public Long getItemId() {
		return itemId;
	}

	public void setItemId(Long itemId) {
		this.itemId = itemId;
	}

	public Long getItemizedStatementId() {
		return itemizedStatementId;
	}

	public void setItemizedStatementId(Long itemizedStatementId) {
		this.itemizedStatementId = itemizedStatementId;
	}

	public String getCustomCategory() {
		return customCategory;
	}

	public void setCustomCategory(String customCategory) {
		this.customCategory = customCategory;
	}

	public String getWorkType() {
		return workType;
	}

	public void setWorkType(String workType) {
		this.workType = workType;
	}

	public String getName() {
		return name;
	}

	public void setName(String name) {
		this.name = name;
	}

	public String getSpecification() {
		return specification;
	}

	public void setSpecification(String specification) {
		this.specification = specification;
	}

	public String getUnit() {
		return unit;
	}

	public void setUnit(String unit) {
		this.unit = unit;
	}

	public BigDecimal getQuantity() {
		return quantity;
	}

	public void setQuantity(BigDecimal quantity) {
		this.quantity = quantity;
	}

	public int getDisplayOrder() {
		return displayOrder;
	}

	public void setDisplayOrder(int displayOrder) {
		this.displayOrder = displayOrder;
	}
}
