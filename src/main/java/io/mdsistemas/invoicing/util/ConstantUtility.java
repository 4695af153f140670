package io.mdsistemas.invoicing.util;

public class ConstantUtility {

	public static final String DISPLAY_DATE_PATTERN = "dd/MM/yyyy";

	public static final int INVOICE_NUMBER_BASE = 1000;

	public static final int DISPLAY_NAME_MAX_CUSTOMER_CHARS = 30;

	public static final String SALE_DATE_COLUMN = "Data";

	public static final String DUE_DATE_COLUMN = "Venc";

	public static final String AMOUNT_DUE_COLUMN = "V. Devido";

	public static final String AMOUNT_RECEIVED_COLUMN = "V. Receb";

	public static final String AMOUNT_DISCOUNT_COLUMN = "V. Desc";

	public static final String DEFAULT_CUSTOMER_NAME = "Consumidor";

	public static final String DEFAULT_DASH = "-";

	public static final String DEFAULT_TITLE = "Serviço";

	public static final String DEFAULT_SPECIES = "NF-e";

	public static final String DEFAULT_ACCOUNT_PLAN = "Fidelizado";

	public static final String FILE_MISSING = "Nenhum arquivo enviado";

	public static final String STATUS_UPDATED = "Status atualizado!";

	private ConstantUtility() {
	}
}
