package io.mdsistemas.invoicing.controller;

import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.info.BuildProperties;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import io.mdsistemas.invoicing.baseobject.Docs;
import io.mdsistemas.invoicing.baseobject.Version;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;

@RestController
@Slf4j
@Tag(name = "Health Check", description = "Liveness and build information")
public class HealthCheckController {

	@Autowired
	private BuildProperties buildProperties;

	@Operation(summary = "Service liveness with a link to the API documentation")
	@GetMapping({"/health"})
	public Version getVersion(HttpServletRequest httpServletRequest) {
		log.debug("inside getVersion() method start");
		Docs docs = new Docs();
		String builtAt = buildProperties.get("time");
		docs.setStatus(StringUtils.isBlank(builtAt) ? "Live" : "Live - " + builtAt);
		docs.setUrl(httpServletRequest.getRequestURL().toString().replace("health", "swagger-ui.html"));
		Version version = new Version();
		version.setVersion(getClass().getPackage().getImplementationVersion());
		version.setDocs(docs);
		log.debug("inside getVersion() method end");
		return version;
	}
}
