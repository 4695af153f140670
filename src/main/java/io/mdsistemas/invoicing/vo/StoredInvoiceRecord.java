package io.mdsistemas.invoicing.vo;

import java.util.Map;

import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.Data;

@Data
public class StoredInvoiceRecord {

	private Long id;

	@JsonProperty("empresa")
	private String customerName;

	@JsonProperty("data")
	private String emissionDate;

	@JsonProperty("valor")
	private String amountDue;

	private String status;

	@JsonProperty("isCadastrado")
	private boolean registered;

	@JsonProperty("arquivoBase64")
	private String documentBase64;

	@JsonProperty("detalhesCompletos")
	private Map<String, Object> details;
}
