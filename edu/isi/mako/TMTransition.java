package edu.isi.mako;

import java.util.ArrayList;

// TM transition: source state, symbol read, symbol written, head direction, destination state
public class TMTransition {

	public enum Direction {
		LEFT('l'), RIGHT('r');
		private final char code;
		Direction(char code) { this.code = code; }
		public char getCode() { return code; }
		public static Direction get(String s) throws DataFormatException {
			for (Direction d : Direction.values()) {
				if (s.length() == 1 && s.charAt(0) == d.code)
					return d;
			}
			throw new DataFormatException("Direction "+s+" must be 'l' or 'r'");
		}
	}

	private final String source;
	private final char read;
	private final char write;
	private final Direction direction;
	private final String destination;

	public TMTransition(String source, char read, char write, Direction direction, String destination) {
		this.source = source;
		this.read = read;
		this.write = write;
		this.direction = direction;
		this.destination = destination;
	}

	// <state>:<read>[,<read>...]>[<write>,]<dir>:<state>
	// one transition per read symbol. without a write symbol each read symbol is written back
	public static ArrayList<TMTransition> parseLine(String line) throws DataFormatException {
		String[] parts = DescriptionReader.splitTransition(line);
		String label = parts[1];
		if (label.length() < 3)
			throw new DataFormatException("Label too short in "+line);
		int arrow = label.indexOf('>');
		String lhs = label.substring(0, arrow);
		String rhs = label.substring(arrow+1);
		ArrayList<Character> reads = new ArrayList<Character>();
		for (String r : lhs.split(",", -1))
			reads.add(symbol(r, line));
		Character written = null;
		String dir = rhs;
		if (rhs.indexOf(',') >= 0) {
			String[] wd = rhs.split(",", -1);
			if (wd.length != 2)
				throw new DataFormatException("Expected write,direction in "+line);
			written = symbol(wd[0], line);
			dir = wd[1];
		}
		Direction d = Direction.get(dir);
		ArrayList<TMTransition> ret = new ArrayList<TMTransition>();
		for (Character r : reads)
			ret.add(new TMTransition(parts[0], r, written == null ? r : written, d, parts[2]));
		return ret;
	}

	private static char symbol(String s, String line) throws DataFormatException {
		if (s.length() != 1)
			throw new DataFormatException("Tape symbols are single characters; saw '"+s+"' in "+line);
		return s.charAt(0);
	}

	// accessors
	public String getSource() { return source; }
	public char getRead() { return read; }
	public char getWrite() { return write; }
	public Direction getDirection() { return direction; }
	public String getDestination() { return destination; }

	public boolean equals(Object o) {
		if (!(o instanceof TMTransition))
			return false;
		TMTransition t = (TMTransition)o;
		return source.equals(t.source) && read == t.read && write == t.write && direction == t.direction &&
			destination.equals(t.destination);
	}

	public int hashCode() {
		int h = source.hashCode();
		h = 31*h + read;
		h = 31*h + write;
		h = 31*h + direction.hashCode();
		return 31*h + destination.hashCode();
	}

	public String toString() {
		return source+":"+read+">"+write+","+direction.getCode()+":"+destination;
	}
}
