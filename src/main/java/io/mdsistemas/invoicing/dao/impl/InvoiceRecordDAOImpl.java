package io.mdsistemas.invoicing.dao.impl;

import java.util.List;
import java.util.Map;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import io.mdsistemas.invoicing.baseobject.InvoicingDataAccessException;
import io.mdsistemas.invoicing.dao.InvoiceRecordDAO;
import io.mdsistemas.invoicing.exception.InvoicingExceptionMessage;
import io.mdsistemas.invoicing.request.InvoiceRecordRequest;
import io.mdsistemas.invoicing.vo.StoredInvoiceRecord;
import lombok.extern.slf4j.Slf4j;

@Service
@Slf4j
public class InvoiceRecordDAOImpl implements InvoiceRecordDAO {

	private static final TypeReference<Map<String, Object>> DETAILS_TYPE = new TypeReference<>() {
	};

	@Autowired
	@Qualifier("invoicingJdbcTemplate")
	private JdbcTemplate invoicingJdbcTemplate;

	@Autowired
	private ObjectMapper objectMapper;

	@Override
	public List<StoredInvoiceRecord> findAllNewestFirst() {
		final String sql = """
				    SELECT
				      r.id,
				      r.customer_name,
				      r.emission_date,
				      r.amount_due,
				      r.status,
				      r.is_registered,
				      r.document_base64,
				      r.details_json
				    FROM invoice_record r
				    ORDER BY r.id DESC
				""";
		try {
			return invoicingJdbcTemplate.query(sql, (rs, n) -> {
				StoredInvoiceRecord rec = new StoredInvoiceRecord();
				rec.setId(rs.getLong("id"));
				rec.setCustomerName(rs.getString("customer_name"));
				rec.setEmissionDate(rs.getString("emission_date"));
				rec.setAmountDue(rs.getString("amount_due"));
				rec.setStatus(rs.getString("status"));
				rec.setRegistered(rs.getBoolean("is_registered"));
				rec.setDocumentBase64(rs.getString("document_base64"));
				rec.setDetails(readDetails(rs.getString("details_json")));
				return rec;
			});
		} catch (DataAccessException ex) {
			throw failure("Falha ao listar notas", InvoicingExceptionMessage.RECORD_READ_FAILED, ex);
		}
	}

	@Override
	public boolean existsByHash(String recordHash) {
		final String sql = "SELECT COUNT(*) FROM invoice_record WHERE record_hash = ?";
		try {
			Integer count = invoicingJdbcTemplate.queryForObject(sql, Integer.class, recordHash);
			return count != null && count > 0;
		} catch (DataAccessException ex) {
			throw failure("Falha ao consultar notas", InvoicingExceptionMessage.RECORD_READ_FAILED, ex);
		}
	}

	@Override
	public int insert(InvoiceRecordRequest record, String recordHash) {
		final String sql = """
				    INSERT INTO invoice_record
				      (customer_name, emission_date, amount_due, status, is_registered, document_base64, details_json, record_hash)
				    VALUES (?, ?, ?, ?, ?, ?, ?, ?)
				""";
		try {
			return invoicingJdbcTemplate.update(sql, record.getCustomerName(), record.getEmissionDate(),
					record.getAmountDue(), record.getStatus(), record.isRegistered(), record.getDocumentBase64(),
					writeDetails(record.getDetails()), recordHash);
		} catch (DataAccessException ex) {
			throw failure("Falha ao salvar nota", InvoicingExceptionMessage.RECORD_PERSIST_FAILED, ex);
		}
	}

	@Override
	public int updateRegistered(long id, boolean registered) {
		final String sql = """
				    UPDATE invoice_record
				    SET is_registered = ?
				    WHERE id = ?
				""";
		try {
			return invoicingJdbcTemplate.update(sql, registered, id);
		} catch (DataAccessException ex) {
			throw failure("Falha ao atualizar nota", InvoicingExceptionMessage.RECORD_PERSIST_FAILED, ex);
		}
	}

	private Map<String, Object> readDetails(String json) {
		if (json == null || json.isBlank()) {
			return Map.of();
		}
		try {
			return objectMapper.readValue(json, DETAILS_TYPE);
		} catch (JsonProcessingException ex) {
			throw failure("Detalhes da nota ilegíveis", InvoicingExceptionMessage.RECORD_READ_FAILED, ex);
		}
	}

	private String writeDetails(Map<String, Object> details) {
		if (details == null) {
			return null;
		}
		try {
			return objectMapper.writeValueAsString(details);
		} catch (JsonProcessingException ex) {
			throw failure("Detalhes da nota inválidos", InvoicingExceptionMessage.RECORD_PERSIST_FAILED, ex);
		}
	}

	/**
	 * Driver and SQL detail stay in the log; the client only gets {@code message}.
	 */
	private InvoicingDataAccessException failure(String message, InvoicingExceptionMessage reason, Exception cause) {
		log.error("{} [{}]", message, reason, cause);
		return new InvoicingDataAccessException(message, reason.getCode(), cause);
	}
}
