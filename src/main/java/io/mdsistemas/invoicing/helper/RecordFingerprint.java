package io.mdsistemas.invoicing.helper;

import java.nio.charset.StandardCharsets;

import org.springframework.stereotype.Component;
import org.springframework.util.DigestUtils;

/**
 * Content key used to refuse importing the same invoice twice. MD5 over the fields joined by {@code -};
 * not a security mechanism.
 */
@Component
public class RecordFingerprint {

	private static final String DELIMITER = "-";

	public String fingerprint(String... identityFields) {
		StringBuilder raw = new StringBuilder();
		for (int i = 0; i < identityFields.length; i++) {
			if (i > 0) {
				raw.append(DELIMITER);
			}
			raw.append(identityFields[i]);
		}
		return DigestUtils.md5DigestAsHex(raw.toString().getBytes(StandardCharsets.UTF_8));
	}
}
