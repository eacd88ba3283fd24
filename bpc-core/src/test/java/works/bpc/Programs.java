package works.bpc;

/**
 * Source programs shared by several tests.
 */
final class Programs {
	private Programs() { }

	/**
	 * Reads a and b, leaves a*b in the third cell using the fourth as scratch, and prints it.
	 * Needs four cells.
	 */
	static final String MULTIPLICATION = """
		read a and b
		,>,<

		| a | b | c | d |
		compute c = a*b using d as temp (pointer starts and ends and a)
		[

		    sum b to c and copy in d (ends in b)
		    >[->+>+<<]

		    move d in b (ends in d)
		    >>[-<<+>>]

		    back on a
		    <<<-
		]

		print c
		>>.
		""";

	/**
	 * Echoes numbers until it reads a zero, or runs out of input.
	 */
	static final String ECHO = ",[.,]";

	/**
	 * Prints 65 using a loop to multiply.
	 */
	static final String SIXTY_FIVE = "++++++++[>++++++++<-]>+.";

	/**
	 * Prints 12 using two nested loops.
	 */
	static final String NESTED = "++[>+++[>++<-]<-]>>.";
}
