package io.mdsistemas.invoicing.controller;

import java.util.List;

import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import io.mdsistemas.invoicing.baseobject.MessageResponse;
import io.mdsistemas.invoicing.request.InvoiceRecordRequest;
import io.mdsistemas.invoicing.request.RegistrationUpdateRequest;
import io.mdsistemas.invoicing.response.SaveInvoicesResponse;
import io.mdsistemas.invoicing.service.InvoiceProcessingService;
import io.mdsistemas.invoicing.service.InvoiceRecordService;
import io.mdsistemas.invoicing.util.ConstantUtility;
import io.mdsistemas.invoicing.vo.DatePolicy;
import io.mdsistemas.invoicing.vo.InvoiceData;
import io.mdsistemas.invoicing.vo.StoredInvoiceRecord;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Invoices", description = "Spreadsheet processing and invoice history")
public class InvoiceController {

	private final InvoiceProcessingService invoiceProcessingService;

	private final InvoiceRecordService invoiceRecordService;

	@Operation(summary = "Turn every row of an uploaded spreadsheet into an invoice document")
	@PostMapping(value = "/processar-notas", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
	public ResponseEntity<List<InvoiceData>> processInvoices(
			@RequestParam(value = "file", required = false) MultipartFile file,
			@RequestParam(value = "modoData", defaultValue = "atual") String dateMode,
			@RequestParam(value = "dataCustom", defaultValue = "") String customDate) {
		log.debug("processInvoices mode={} custom={}", dateMode, customDate);
		List<InvoiceData> invoices = invoiceProcessingService.process(file,
				DatePolicy.fromRequest(dateMode, customDate));
		return ResponseEntity.ok(invoices);
	}

	@Operation(summary = "List saved invoices, newest first")
	@GetMapping("/notas")
	public ResponseEntity<List<StoredInvoiceRecord>> listInvoices() {
		return ResponseEntity.ok(invoiceRecordService.listRecords());
	}

	@Operation(summary = "Save a batch of invoices, skipping ones already stored")
	@PostMapping("/notas")
	public ResponseEntity<SaveInvoicesResponse> saveInvoices(@RequestBody List<InvoiceRecordRequest> records) {
		return ResponseEntity.status(HttpStatus.CREATED).body(invoiceRecordService.saveRecords(records));
	}

	@Operation(summary = "Mark an invoice as registered in the tax system, or unmark it")
	@PutMapping("/notas/{id}")
	public ResponseEntity<MessageResponse> updateRegistration(@PathVariable("id") long id,
			@RequestBody RegistrationUpdateRequest request) {
		invoiceRecordService.updateRegistered(id, request.isRegistered());
		return ResponseEntity.ok(new MessageResponse(ConstantUtility.STATUS_UPDATED));
	}
}
