package com.consullo.printlog.file;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for preamble injection and line state transitions.
 *
 * @since 1.0
 */
public class LineFormatterTest {

  private static final String TS = "10:15:30";
  private static final String TAG = "[INFO]";

  @Test
  @DisplayName("Should prefix a terminated line and end fresh")
  void format_TerminatedLine_PreambleAndFresh() {
    final FormattedEntry e = LineFormatter.format("hello\n", TAG, TS, LineState.FRESH_LINE);

    assertThat(e.text()).isEqualTo("[10:15:30] [INFO] hello\n");
    assertThat(e.lastPreambleIndex()).isZero();
    assertThat(e.endState()).isEqualTo(LineState.FRESH_LINE);
  }

  @Test
  @DisplayName("Should leave an unterminated line open")
  void format_UnterminatedLine_EndsMidLine() {
    final FormattedEntry e = LineFormatter.format("Loading", TAG, TS, LineState.FRESH_LINE);

    assertThat(e.text()).isEqualTo("[10:15:30] [INFO] Loading");
    assertThat(e.endState()).isEqualTo(LineState.MID_LINE);
  }

  @Test
  @DisplayName("Should continue an open line without a preamble")
  void format_Continuation_NoPreamble() {
    final FormattedEntry e = LineFormatter.format("...Done!\n", TAG, TS, LineState.MID_LINE);

    assertThat(e.text()).isEqualTo("...Done!\n");
    assertThat(e.hasPreamble()).isFalse();
    assertThat(e.endState()).isEqualTo(LineState.FRESH_LINE);
  }

  @Test
  @DisplayName("Should repeat the preamble on every new line of a multi-line message")
  void format_MultiLine_PreamblePerLine() {
    final FormattedEntry e = LineFormatter.format("a\nb\nc", "[WARN]", TS, LineState.FRESH_LINE);

    assertThat(e.text()).isEqualTo("[10:15:30] [WARN] a\n[10:15:30] [WARN] b\n[10:15:30] [WARN] c");
    assertThat(e.text().substring(e.lastPreambleIndex())).isEqualTo("[10:15:30] [WARN] c");
    assertThat(e.endState()).isEqualTo(LineState.MID_LINE);
  }

  @Test
  @DisplayName("Should finish an open line and then start tagged lines")
  void format_MidLineThenNewLines_PreambleAfterFirstTerminator() {
    final FormattedEntry e = LineFormatter.format(" tail\nnext\n", TAG, TS, LineState.MID_LINE);

    assertThat(e.text()).isEqualTo(" tail\n[10:15:30] [INFO] next\n");
    assertThat(e.lastPreambleIndex()).isEqualTo(6);
  }

  @Test
  @DisplayName("Should emit a bare preamble for an empty line")
  void format_BlankLines_Preambles() {
    assertThat(LineFormatter.format("\n", TAG, TS, LineState.FRESH_LINE).text())
        .isEqualTo("[10:15:30] [INFO] \n");
    assertThat(LineFormatter.format("\n\n", TAG, TS, LineState.FRESH_LINE).text())
        .isEqualTo("[10:15:30] [INFO] \n[10:15:30] [INFO] \n");
    assertThat(LineFormatter.format("", TAG, TS, LineState.FRESH_LINE).text())
        .isEqualTo("[10:15:30] [INFO] ");
  }
}
