package io.mdsistemas.invoicing.service.impl;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import io.mdsistemas.invoicing.exception.InvoiceProcessingException;
import io.mdsistemas.invoicing.exception.InvoicingExceptionMessage;
import io.mdsistemas.invoicing.exception.NotValidException;
import io.mdsistemas.invoicing.helper.InvoiceRowTransformer;
import io.mdsistemas.invoicing.helper.TabularFileReader;
import io.mdsistemas.invoicing.service.InvoiceProcessingService;
import io.mdsistemas.invoicing.util.ConstantUtility;
import io.mdsistemas.invoicing.vo.DatePolicy;
import io.mdsistemas.invoicing.vo.InvoiceData;
import io.mdsistemas.invoicing.vo.RawRow;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Service
@Slf4j
@RequiredArgsConstructor
public class InvoiceProcessingServiceImpl implements InvoiceProcessingService {

	private final TabularFileReader tabularFileReader;

	private final InvoiceRowTransformer invoiceRowTransformer;

	@Override
	public List<InvoiceData> process(MultipartFile file, DatePolicy datePolicy) {
		if (file == null || file.isEmpty()) {
			throw new NotValidException(InvoicingExceptionMessage.FILE_MISSING, ConstantUtility.FILE_MISSING);
		}
		byte[] content;
		try {
			content = file.getBytes();
		} catch (IOException ex) {
			throw new InvoiceProcessingException(InvoicingExceptionMessage.FILE_UNREADABLE,
					"Não foi possível ler o arquivo enviado: " + ex.getMessage(), ex);
		}
		return process(file.getOriginalFilename(), content, datePolicy);
	}

	/**
	 * Rows are transformed in file order and any failure aborts the whole batch: the caller gets every
	 * document or none.
	 */
	@Override
	public List<InvoiceData> process(String filename, byte[] content, DatePolicy datePolicy) {
		List<RawRow> rows = tabularFileReader.read(filename, content);
		log.info("Processing {} rows from '{}' with date mode {}", rows.size(), filename, datePolicy.mode());

		List<InvoiceData> result = new ArrayList<>(rows.size());
		for (int i = 0; i < rows.size(); i++) {
			result.add(invoiceRowTransformer.transform(i, rows.get(i), datePolicy));
		}
		return result;
	}
}
