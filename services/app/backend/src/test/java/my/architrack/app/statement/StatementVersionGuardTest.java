package my.architrack.app.statement;

import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StatementVersionGuardTest {
	private final StatementVersionGuard guard = new StatementVersionGuard();

	@Test
	void verifyRejectsStaleToken() {
		assertThatThrownBy(() -> guard.verify(1, 2))
				.isInstanceOfSatisfying(StatementConflictException.class, exc -> {
					assertThat(exc.getExpectedVersion()).isEqualTo(1L);
					assertThat(exc.getActualVersion()).isEqualTo(2L);
					assertThat(exc.getCode()).isEqualTo("ITEMIZED_STATEMENT_CONFLICT");
				});
	}

	@Test
	void verifyAcceptsCurrentToken() {
		guard.verify(3, 3);
	}

	@Test
	void writeThatChangedNothingIsAConflict() {
		assertThatThrownBy(() -> guard.guardedWrite(2, version -> 0))
				.isInstanceOfSatisfying(StatementConflictException.class, exc -> {
					assertThat(exc.getExpectedVersion()).isEqualTo(2L);
					assertThat(exc.getActualVersion()).isNull();
				});
	}

	@Test
	void writeReceivesExpectedVersion() {
		AtomicLong seen = new AtomicLong(-1);

		guard.guardedWrite(7, version -> {
			seen.set(version);
			return 1;
		});

		assertThat(seen.get()).isEqualTo(7L);
	}
}
