package io.mdsistemas.invoicing.dao;

import java.util.List;

import io.mdsistemas.invoicing.request.InvoiceRecordRequest;
import io.mdsistemas.invoicing.vo.StoredInvoiceRecord;

public interface InvoiceRecordDAO {

	List<StoredInvoiceRecord> findAllNewestFirst();

	boolean existsByHash(String recordHash);

	int insert(InvoiceRecordRequest record, String recordHash);

	int updateRegistered(long id, boolean registered);

}
