package io.mdsistemas.invoicing.helper;

import static io.mdsistemas.invoicing.util.ConstantUtility.*;

import java.util.List;
import java.util.Set;

import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import io.mdsistemas.invoicing.vo.DatePolicy;
import io.mdsistemas.invoicing.vo.InvoiceData;
import io.mdsistemas.invoicing.vo.RawRow;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Builds the invoice record, document included, for one billing spreadsheet row.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class InvoiceRowTransformer {

	static final ColumnSpec CUSTOMER_NAME = new ColumnSpec(
			List.of("Resp. Fin", "Resp Fin", "Resp. Fin.", "Nome", "Cliente", "Razão Social"),
			Set.of("respfin", "nome", "cliente", "razaosocial"), DEFAULT_CUSTOMER_NAME);

	static final ColumnSpec ORIGIN = ColumnSpec.exact(DEFAULT_DASH, "Origem");

	static final ColumnSpec TAX_ID = ColumnSpec.exact(DEFAULT_DASH, "CPF/CNPJ", "CPF");

	static final ColumnSpec TITLE = ColumnSpec.exact(DEFAULT_TITLE, "Título");

	static final ColumnSpec SPECIES = ColumnSpec.exact(DEFAULT_SPECIES, "Espécie");

	static final ColumnSpec ACCOUNT_PLAN = ColumnSpec.exact(DEFAULT_ACCOUNT_PLAN, "P. Contas");

	static final String RESPONSIBLE_TAX_ID_COLUMN = "CPF Resp";

	private final EmissionDateResolver emissionDateResolver;

	private final ColumnResolver columnResolver;

	private final CurrencyNormalizer currencyNormalizer;

	private final InvoiceDocumentRenderer documentRenderer;

	public InvoiceData transform(int index, RawRow row, DatePolicy policy) {
		String emissionDate = emissionDateResolver.resolve(policy, row);
		String customerName = columnResolver.resolveText(row, CUSTOMER_NAME);
		String taxId = columnResolver.resolveText(row, TAX_ID);
		String responsibleTaxId = row.isPresent(RESPONSIBLE_TAX_ID_COLUMN)
				? CellValues.asText(row.get(RESPONSIBLE_TAX_ID_COLUMN))
				: taxId;

		double amountDue = currencyNormalizer.normalize(row.get(AMOUNT_DUE_COLUMN));
		double amountReceived = currencyNormalizer.normalize(row.get(AMOUNT_RECEIVED_COLUMN));
		double amountDiscount = currencyNormalizer.normalize(row.get(AMOUNT_DISCOUNT_COLUMN));

		String dueDate = row.isPresent(DUE_DATE_COLUMN)
				? CellValues.asText(row.get(DUE_DATE_COLUMN))
				: emissionDateResolver.today();

		InvoiceData invoice = InvoiceData.builder()
				.sequenceIndex(index)
				.displayName(displayName(index, customerName))
				.customerName(customerName)
				.origin(columnResolver.resolveText(row, ORIGIN))
				.taxId(taxId)
				.title(columnResolver.resolveText(row, TITLE))
				.species(columnResolver.resolveText(row, SPECIES))
				.accountPlan(columnResolver.resolveText(row, ACCOUNT_PLAN))
				.responsibleTaxId(responsibleTaxId)
				.amountDue(amountDue)
				.amountReceived(amountReceived)
				.amountDiscount(amountDiscount)
				.amountDueDisplay(currencyNormalizer.format(amountDue))
				.amountReceivedDisplay(currencyNormalizer.format(amountReceived))
				.amountDiscountDisplay(currencyNormalizer.format(amountDiscount))
				.emissionDate(emissionDate)
				.dueDate(dueDate)
				.build();

		invoice.setDocumentBlob(documentRenderer.renderBase64(invoice));
		log.debug("Row {} -> {}", index, invoice.getDisplayName());
		return invoice;
	}

	static String displayName(int index, String customerName) {
		return "NF-" + (INVOICE_NUMBER_BASE + index) + " - "
				+ StringUtils.left(customerName, DISPLAY_NAME_MAX_CUSTOMER_CHARS);
	}
}
