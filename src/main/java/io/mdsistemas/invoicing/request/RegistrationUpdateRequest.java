package io.mdsistemas.invoicing.request;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.Data;

@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class RegistrationUpdateRequest {

	@JsonProperty("isCadastrado")
	private boolean registered;
}
