package io.mdsistemas.invoicing.response;

import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class SaveInvoicesResponse {

	private String message;

	private int saved;

	private int duplicates;
}
