package com.korea.tagscript;

import com.korea.tagscript.tool.DirectoryMerger;
import com.korea.tagscript.tool.MergeSummary;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

@SpringBootApplication
public class TagScriptBootApplication implements CommandLineRunner {

	private static Logger logger = LoggerFactory.getLogger(TagScriptBootApplication.class);

	@Value("${tagscript.version}")
	private String tagScriptVersion;

	@Value("${input-dir:}")
	private String inputDir;

	@Value("${output-dir:}")
	private String outputDir;

	@Value("${tagscript.strict:false}")
	private boolean strict;

	public static void main(String[] args) {
		SpringApplication.run(TagScriptBootApplication.class, args);
	}

	@Override
	public void run(String... args) throws Exception {
		logger.info("==================================");
		logger.info("== tagscript's version is {} ==", tagScriptVersion);
		logger.info("==================================");

		if (inputDir.isEmpty() || outputDir.isEmpty()) {
			logger.error("Usage: --input-dir=<directory> --output-dir=<directory>");
			return;
		}
		Path input = Paths.get(inputDir);
		if (!Files.isDirectory(input)) {
			logger.error("Input directory not found at '{}'", inputDir);
			return;
		}

		DirectoryMerger merger = new DirectoryMerger(Config.newBuilder()
				.strict(strict)
				.build());
		MergeSummary summary = merger.process(input, Paths.get(outputDir));

		logger.info("==================================================");
		logger.info("== copied {}, merged {}, failed {} ==",
				summary.getCopied().size(), summary.getMerged().size(), summary.getFailed().size());
		logger.info("==================================================");
	}
}
