package edu.isi.mako;

// single tape, cells numbered from 0. unbounded to the right: cells past the
// written extent read as blank and are filled with blanks when written past
public class Tape {

	private final StringBuilder cells;

	public Tape(String input) {
		cells = new StringBuilder(input);
	}

	public char read(int head) {
		if (head < 0)
			throw new IndexOutOfBoundsException("Head at "+head);
		if (head >= cells.length())
			return Alphabet.BLANK;
		return cells.charAt(head);
	}

	public void write(int head, char symbol) {
		if (head < 0)
			throw new IndexOutOfBoundsException("Head at "+head);
		while (cells.length() <= head)
			cells.append(Alphabet.BLANK);
		cells.setCharAt(head, symbol);
	}

	// the written extent
	public int length() {
		return cells.length();
	}

	public String toString() {
		return cells.toString();
	}
}
