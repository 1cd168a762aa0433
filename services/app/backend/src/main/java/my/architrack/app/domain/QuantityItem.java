package my.architrack.app.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import org.hibernate.annotations.Immutable;

import java.math.BigDecimal;

@Entity
@Immutable
@Table(name = "quantity_items")
public class QuantityItem {
	@Id
	@Column(name = "quantity_item_id")
	private Long quantityItemId;

	@Column(name = "quantity_group_id", nullable = false)
	private Long quantityGroupId;

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

	@Column(name = "quantity")
	private BigDecimal quantity;

	@Column(name = "display_order", nullable = false)
	private int displayOrder;

	public Long getQuantityItemId() {
		return quantityItemId;
	}

	public void setQuantityItemId(Long quantityItemId) {
		this.quantityItemId = quantityItemId;
	}

	public Long getQuantityGroupId() {
		return quantityGroupId;
	}

	public void setQuantityGroupId(Long quantityGroupId) {
		this.quantityGroupId = quantityGroupId;
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
