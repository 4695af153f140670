package io.mdsistemas.invoicing.service;

import java.util.List;

import org.springframework.web.multipart.MultipartFile;

import io.mdsistemas.invoicing.vo.DatePolicy;
import io.mdsistemas.invoicing.vo.InvoiceData;

public interface InvoiceProcessingService {

	List<InvoiceData> process(MultipartFile file, DatePolicy datePolicy);

	List<InvoiceData> process(String filename, byte[] content, DatePolicy datePolicy);

}
