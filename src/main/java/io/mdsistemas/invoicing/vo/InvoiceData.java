package io.mdsistemas.invoicing.vo;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import io.mdsistemas.invoicing.util.ConstantUtility;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One processed spreadsheet row. JSON names are the ones the upload screen reads.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InvoiceData {

	@JsonProperty("temp_id")
	private int sequenceIndex;

	@JsonProperty("nome_arquivo")
	private String displayName;

	@JsonProperty("respFin")
	private String customerName;

	@JsonProperty("origem")
	private String origin;

	@JsonProperty("cpf")
	private String taxId;

	@JsonProperty("titulo")
	private String title;

	@JsonProperty("especie")
	private String species;

	@JsonProperty("pContas")
	private String accountPlan;

	@JsonProperty("cpfResp")
	private String responsibleTaxId;

	@JsonProperty("valorDevido")
	private double amountDue;

	@JsonProperty("valorRecebido")
	private double amountReceived;

	@JsonProperty("valorDesconto")
	private double amountDiscount;

	@JsonProperty("vDevido")
	private String amountDueDisplay;

	@JsonProperty("vReceb")
	private String amountReceivedDisplay;

	@JsonProperty("vDesc")
	private String amountDiscountDisplay;

	@JsonProperty("data")
	private String emissionDate;

	@JsonProperty("venc")
	private String dueDate;

	@JsonProperty("arquivo")
	private String documentBlob;

	@JsonIgnore
	public int getInvoiceNumber() {
		return ConstantUtility.INVOICE_NUMBER_BASE + sequenceIndex;
	}
}
