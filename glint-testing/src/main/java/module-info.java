/**
 * Utilities for testing code that uses Glint values:
 * seeded random generators and the round-trip properties every conversion should satisfy.
 */
module works.glint.testing {
	requires transitive works.glint.core;

	requires static lombok;

	exports works.glint.testing;
}
