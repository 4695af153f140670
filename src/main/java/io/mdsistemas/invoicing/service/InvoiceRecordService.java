package io.mdsistemas.invoicing.service;

import java.util.List;

import io.mdsistemas.invoicing.request.InvoiceRecordRequest;
import io.mdsistemas.invoicing.response.SaveInvoicesResponse;
import io.mdsistemas.invoicing.vo.StoredInvoiceRecord;

public interface InvoiceRecordService {

	List<StoredInvoiceRecord> listRecords();

	SaveInvoicesResponse saveRecords(List<InvoiceRecordRequest> records);

	void updateRegistered(long id, boolean registered);

}
