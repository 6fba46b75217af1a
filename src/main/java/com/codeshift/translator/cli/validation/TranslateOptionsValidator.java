package com.codeshift.translator.cli.validation;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.codeshift.translator.cli.exception.OptionsValidationException;
import com.codeshift.translator.cli.model.LineEnding;
import com.codeshift.translator.cli.model.TranslateOptions;
import com.codeshift.translator.cli.model.ValidatedTranslateOptions;
import com.codeshift.translator.io.FileWriteUtil;

public class TranslateOptionsValidator {

	static final int MAX_INDENT_WIDTH = 16;

	public ValidatedTranslateOptions validate(TranslateOptions o) {
		List<String> errors = new ArrayList<>();

		Path input = null;
		if (o.getInputFile() == null) {
			errors.add("A syntax tree document is required (TREE).");
		} else {
			input = o.getInputFile().toAbsolutePath().normalize();
			if (!Files.isRegularFile(input)) {
				errors.add("Syntax tree document does not exist or is not a file: " + o.getInputFile());
			}
		}

		if (o.getIndentWidth() < 0 || o.getIndentWidth() > MAX_INDENT_WIDTH) {
			errors.add("Indent must be in range 0-" + MAX_INDENT_WIDTH + ". Got: " + o.getIndentWidth());
		}

		Path output = null;
		if (o.getOutputFile() != null) {
			output = o.getOutputFile().toAbsolutePath().normalize();
		} else if (input != null) {
			output = FileWriteUtil.withExtension(input, "ts");
		}

		if (output != null) {
			if (output.equals(input)) {
				errors.add("Output file must differ from the input document: " + output);
			} else if (Files.isDirectory(output)) {
				errors.add("Output path is a directory: " + output);
			} else if (Files.exists(output) && !o.isForce() && !o.isDryRun()) {
				errors.add("Output file already exists: " + output + ". Use --force to overwrite.");
			}
		}

		if (!errors.isEmpty()) {
			throw new OptionsValidationException(errors);
		}

		LineEnding lineEnding = o.getLineEnding() != null ? o.getLineEnding() : LineEnding.SYSTEM;
		return new ValidatedTranslateOptions(input, output, lineEnding.separator());
	}
}
