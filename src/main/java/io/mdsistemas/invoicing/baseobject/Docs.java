package io.mdsistemas.invoicing.baseobject;

import lombok.Data;

@Data
public class Docs {

	private String status;

	private String url;
}
