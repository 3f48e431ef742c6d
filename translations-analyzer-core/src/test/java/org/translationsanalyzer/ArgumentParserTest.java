package org.translationsanalyzer;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.*;

@DisplayName("ArgumentParser Tests")
class ArgumentParserTest {

	private ArgumentParser argumentParser;

	@BeforeEach
	void setUp() {
		argumentParser = new ArgumentParser(".", "settings.json");
	}

	@Nested
	@DisplayName("Basic Argument Parsing Tests")
	class BasicArgumentParsingTest {

		@Test
		@DisplayName("Should apply defaults for a bare global report")
		void shouldApplyDefaults() {
			ParsedConfiguration config = argumentParser.parseAndValidate(new String[] { "global-report" });

			assertThat(config.command).isEqualTo(ArgumentParser.GLOBAL_REPORT);
			assertThat(config.rootPath).isEqualTo(".");
			assertThat(config.configFilePath).isEqualTo("settings.json");
			assertThat(config.packagePath).isNull();
			assertThat(config.format).isEqualTo(OutputFormat.TEXT);
			assertThat(config.verbose).isFalse();
			assertThat(config.isDetailed()).isFalse();
		}

		@Test
		@DisplayName("Should parse every option of a detailed report")
		void shouldParseDetailedReport() {
			String[] args = { "detailed-report", "--root-path", "/repo", "--config-file-path", "/repo/settings.json",
					"--package-path", "packages/manager/apps/zimbra", "--format", "json", "--verbose" };

			ParsedConfiguration config = argumentParser.parseAndValidate(args);

			assertThat(config.isDetailed()).isTrue();
			assertThat(config.rootPath).isEqualTo("/repo");
			assertThat(config.configFilePath).isEqualTo("/repo/settings.json");
			assertThat(config.packagePath).isEqualTo("packages/manager/apps/zimbra");
			assertThat(config.format).isEqualTo(OutputFormat.JSON);
			assertThat(config.verbose).isTrue();
		}

		@Test
		@DisplayName("Should accept short options and options before the command")
		void shouldParseShortOptions() {
			String[] args = { "-p", "apps/web", "-f", "JSON", "-v", "global-report" };

			ParsedConfiguration config = argumentParser.parseAndValidate(args);

			assertThat(config.command).isEqualTo(ArgumentParser.GLOBAL_REPORT);
			assertThat(config.packagePath).isEqualTo("apps/web");
			assertThat(config.format).isEqualTo(OutputFormat.JSON);
			assertThat(config.verbose).isTrue();
		}

	}

	@Nested
	@DisplayName("Validation Tests")
	class ValidationTest {

		@Test
		@DisplayName("Should require a command")
		void shouldRequireCommand() {
			assertThatThrownBy(() -> argumentParser.parseAndValidate(new String[] { "--root-path", "/repo" }))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("A command is required");
		}

		@Test
		@DisplayName("Should reject two commands")
		void shouldRejectTwoCommands() {
			assertThatThrownBy(
					() -> argumentParser.parseAndValidate(new String[] { "global-report", "detailed-report" }))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("Only one command allowed");
		}

		@Test
		@DisplayName("Should require a package path for detailed reports")
		void shouldRequirePackagePathForDetailedReport() {
			assertThatThrownBy(() -> argumentParser.parseAndValidate(new String[] { "detailed-report" }))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("requires --package-path");
		}

		@Test
		@DisplayName("Should reject empty paths")
		void shouldRejectEmptyPaths() {
			String[] args = { "global-report", "--root-path", " ", "--package-path", "" };

			assertThatThrownBy(() -> argumentParser.parseAndValidate(args))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageStartingWith("Configuration validation failed:")
				.hasMessageContaining("Root path cannot be empty")
				.hasMessageContaining("Package path cannot be empty");
		}

		@ParameterizedTest
		@ValueSource(strings = { "--root-path", "--config-file-path", "--package-path", "--format" })
		@DisplayName("Should reject options missing their value")
		void shouldRejectMissingValue(String option) {
			assertThatThrownBy(() -> argumentParser.parseAndValidate(new String[] { "global-report", option }))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("Missing value");
		}

		@Test
		@DisplayName("Should reject unknown formats")
		void shouldRejectUnknownFormat() {
			assertThatThrownBy(
					() -> argumentParser.parseAndValidate(new String[] { "global-report", "--format", "xml" }))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("Invalid format");
		}

		@ParameterizedTest
		@ValueSource(strings = { "--unknown", "report" })
		@DisplayName("Should reject unknown options and commands")
		void shouldRejectUnknownArguments(String arg) {
			assertThatThrownBy(() -> argumentParser.parseAndValidate(new String[] { "global-report", arg }))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("Unknown");
		}

	}

	@Nested
	@DisplayName("Help Tests")
	class HelpTest {

		@Test
		@DisplayName("Should skip validation when help is requested")
		void shouldSkipValidationForHelp() {
			ParsedConfiguration config = argumentParser.parseAndValidate(new String[] { "--help" });

			assertThat(config.helpRequested).isTrue();
			assertThat(config.command).isNull();
		}

		@Test
		@DisplayName("Should detect help without parsing")
		void shouldDetectHelp() {
			assertThat(argumentParser.isHelpRequested(new String[] { "global-report", "-h" })).isTrue();
			assertThat(argumentParser.isHelpRequested(new String[] { "global-report" })).isFalse();
		}

		@Test
		@DisplayName("Should describe commands, options and defaults")
		void shouldGenerateHelpText() {
			String help = argumentParser.generateHelpText();

			assertThat(help).contains("global-report", "detailed-report", "--root-path", "--config-file-path",
					"--package-path", "--format", "default: settings.json",
					EnvironmentSupport.ROOT_PATH_VARIABLE);
		}

	}

}
