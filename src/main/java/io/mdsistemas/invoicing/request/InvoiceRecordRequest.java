package io.mdsistemas.invoicing.request;

import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.Data;

@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class InvoiceRecordRequest {

	@JsonProperty("empresa")
	private String customerName;

	@JsonProperty("data")
	private String emissionDate;

	/** Amount exactly as the client displayed it, e.g. {@code R$ 1.234,56}. */
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
