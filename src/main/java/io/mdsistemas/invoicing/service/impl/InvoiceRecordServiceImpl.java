package io.mdsistemas.invoicing.service.impl;

import java.util.List;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import io.mdsistemas.invoicing.dao.InvoiceRecordDAO;
import io.mdsistemas.invoicing.exception.InvoicingExceptionMessage;
import io.mdsistemas.invoicing.exception.NotValidException;
import io.mdsistemas.invoicing.exception.ResourceNotFoundException;
import io.mdsistemas.invoicing.helper.RecordFingerprint;
import io.mdsistemas.invoicing.request.InvoiceRecordRequest;
import io.mdsistemas.invoicing.response.SaveInvoicesResponse;
import io.mdsistemas.invoicing.service.InvoiceRecordService;
import io.mdsistemas.invoicing.vo.StoredInvoiceRecord;
import lombok.extern.slf4j.Slf4j;

@Service
@Slf4j
public class InvoiceRecordServiceImpl implements InvoiceRecordService {

	@Autowired
	private InvoiceRecordDAO invoiceRecordDAO;

	@Autowired
	private RecordFingerprint recordFingerprint;

	@Override
	@Transactional(readOnly = true)
	public List<StoredInvoiceRecord> listRecords() {
		return invoiceRecordDAO.findAllNewestFirst();
	}

	@Override
	@Transactional
	public SaveInvoicesResponse saveRecords(List<InvoiceRecordRequest> records) {
		int saved = 0;
		int duplicates = 0;
		for (InvoiceRecordRequest record : records) {
			validate(record);
			String hash = recordFingerprint.fingerprint(record.getCustomerName(), record.getEmissionDate(),
					record.getAmountDue());
			if (invoiceRecordDAO.existsByHash(hash)) {
				duplicates++;
				continue;
			}
			invoiceRecordDAO.insert(record, hash);
			saved++;
		}
		log.info("Saved {} invoice records, skipped {} duplicates", saved, duplicates);

		String message = saved + " notas salvas.";
		if (duplicates > 0) {
			message += " (" + duplicates + " duplicatas já existiam)";
		}
		return new SaveInvoicesResponse(message, saved, duplicates);
	}

	@Override
	@Transactional
	public void updateRegistered(long id, boolean registered) {
		int updated = invoiceRecordDAO.updateRegistered(id, registered);
		if (updated == 0) {
			throw new ResourceNotFoundException("Nota", "id", id);
		}
	}

	private void validate(InvoiceRecordRequest record) {
		if (record == null || record.getCustomerName() == null || record.getEmissionDate() == null
				|| record.getAmountDue() == null) {
			throw new NotValidException(InvoicingExceptionMessage.INVALID_RECORD,
					"Nota sem empresa, data ou valor não pode ser salva");
		}
	}
}
