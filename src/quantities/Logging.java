/*
 * MIT License
 *
 * Copyright (c) 2022 Justin Kunimune
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */
package quantities;

import java.io.UnsupportedEncodingException;
import java.util.logging.Formatter;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

/**
 * Everything in this package logs to the "quantities" logger, and only at FINE: when a
 * division's error is declared unbounded and when an error gets its leading-one digit.
 * Turn it on with {@link #configureLogger(Level)} to see why a result came out the way
 * it did.
 */
public class Logging {

	public static final String LOGGER_NAME = "quantities";

	/**
	 * configure the logger this package writes to
	 * @return that logger
	 */
	public static Logger configureLogger(Level level) throws UnsupportedEncodingException {
		Logger logger = Logger.getLogger(LOGGER_NAME);
		configureLogger(logger, level);
		return logger;
	}

	/**
	 * put a logger's parent handlers on the one-line "time | level | message" format, in
	 * UTF-8 so that the ± and ∞ in formatted quantities survive, and let thru everything
	 * at or above the given level.
	 */
	public static void configureLogger(Logger logger, Level level) throws UnsupportedEncodingException {
		logger.setLevel(level);
		for (Handler handler: logger.getParent().getHandlers()) {
			handler.setFormatter(new OneLineFormatter());
			handler.setEncoding("UTF-8");
			handler.setLevel(level);
		}
	}

	static class OneLineFormatter extends Formatter {
		@Override
		public String format(LogRecord record) {
			String line = String.format("%1$ta %1$tH:%1$tM:%1$tS | %2$s | %3$s",
			                            record.getMillis(), record.getLevel(), this.formatMessage(record));
			if (record.getThrown() != null)
				line += " (" + record.getThrown() + ")";
			return line + System.lineSeparator();
		}
	}
}
