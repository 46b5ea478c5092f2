package org.springaicommunity.github.reporter;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

@DisplayName("FindingsReader Tests")
class FindingsReaderTest {

	private FindingsReader reader;

	@BeforeEach
	void setUp() {
		reader = new FindingsReader(ObjectMapperFactory.create());
	}

	@Test
	@DisplayName("Should read strings and objects of every kind")
	void shouldReadAllKinds() {
		FindingSet set = reader.parse("""
				{
				  "warnings": ["Big PR"],
				  "errors": [{"message": "Tests failing", "sticky": true}, "Lint"],
				  "messages": [{"message": "Thanks"}],
				  "markdowns": ["## Notes"]
				}
				""");

		assertThat(set.warnings()).containsExactly(Finding.warning("Big PR"));
		assertThat(set.errors()).containsExactly(Finding.error("Tests failing").asSticky(), Finding.error("Lint"));
		assertThat(set.messages()).containsExactly(Finding.message("Thanks"));
		assertThat(set.markdowns()).containsExactly(Finding.markdown("## Notes"));
	}

	@Test
	@DisplayName("Should treat missing and null arrays as empty")
	void shouldTreatMissingArraysAsEmpty() {
		FindingSet set = reader.parse("{\"errors\": null}");

		assertThat(set.isEmpty()).isTrue();
	}

	@ParameterizedTest
	@ValueSource(strings = { "not json", "[]", "{\"errors\": \"x\"}", "{\"errors\": [42]}",
			"{\"warnings\": [{\"sticky\": true}]}" })
	@DisplayName("Should reject invalid documents")
	void shouldRejectInvalidDocuments(String json) {
		assertThatThrownBy(() -> reader.parse(json)).isInstanceOf(IllegalArgumentException.class);
	}

	@Test
	@DisplayName("Should read a findings file")
	void shouldReadFile(@TempDir Path tempDir) throws Exception {
		Path file = tempDir.resolve("findings.json");
		Files.writeString(file, "{\"errors\": [\"boom\"]}");

		assertThat(reader.read(file).errorCount()).isEqualTo(1);
	}

}
