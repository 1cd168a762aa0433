package my.architrack.app.statement;

import java.util.function.LongUnaryOperator;

/**
 * Optimistic check for the statement's only mutation. Nothing is locked between the caller's
 * read and its write: the write itself is conditional on the version the caller observed.
 */
public class StatementVersionGuard {

	public void verify(long expectedVersion, long currentVersion) {
		if (expectedVersion != currentVersion) {
			throw new StatementConflictException(expectedVersion, currentVersion);
		}
	}

	/**
	 * Runs a conditional write that returns the number of rows it changed.
	 * Zero means a concurrent writer got there first.
	 */
	public void guardedWrite(long expectedVersion, LongUnaryOperator conditionalWrite) {
		long updated = conditionalWrite.applyAsLong(expectedVersion);
		if (updated == 0) {
			throw new StatementConflictException(expectedVersion, null);
		}
	}
}
