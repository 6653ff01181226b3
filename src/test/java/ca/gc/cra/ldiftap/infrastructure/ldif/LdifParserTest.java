package ca.gc.cra.ldiftap.infrastructure.ldif;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.ldiftap.domain.ldif.EntryFilterPolicy;
import ca.gc.cra.ldiftap.domain.ldif.LdifEntry;
import ca.gc.cra.ldiftap.domain.ldif.LdifIssue;
import ca.gc.cra.ldiftap.domain.ldif.LdifParseException;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.io.IOException;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.Set;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

class LdifParserTest {
  private static final EntryFilterPolicy STRICT = EntryFilterPolicy.defaults();
  private static final EntryFilterPolicy LENIENT = EntryFilterPolicy.defaults().withStrictParsing(false);

  @TempDir Path tempDir;

  @Test
  void parsesSingleEntryAndTrimsDn() {
    List<LdifEntry> entries = parseAll(STRICT, """
        dn:   cn=John Doe,dc=example,dc=com \s
        cn: John Doe
        sn: Doe
        objectClass: person
        """);

    assertEquals(1, entries.size());
    LdifEntry entry = entries.get(0);
    assertEquals("cn=John Doe,dc=example,dc=com", entry.dn());
    assertEquals("John Doe", entry.attribute("cn").orElseThrow().toRecordValue());
    assertEquals("Doe", entry.attribute("sn").orElseThrow().toRecordValue());
    assertEquals(List.of("person"), entry.objectClass());
    assertEquals(1, entry.lineNumber());
    assertEquals("test.ldif", entry.sourceFile());
  }

  @Test
  void continuationLineDropsExactlyOneLeadingSpace() {
    List<LdifEntry> entries = parseAll(STRICT, "dn: cn=x\ndescription: Hello\n  World\n");

    assertEquals("Hello World", entries.get(0).attribute("description").orElseThrow().toRecordValue());
  }

  @Test
  void continuationExtendsDnAndBase64Payloads() {
    List<LdifEntry> entries = parseAll(STRICT, "dn: cn=very long,\n dc=example\ncn:: Sm9o\n bg==\n");

    LdifEntry entry = entries.get(0);
    assertEquals("cn=very long,dc=example", entry.dn());
    assertEquals("John", entry.attribute("cn").orElseThrow().toRecordValue());
  }

  @Test
  void base64PayloadIgnoresWhitespaceFromFolding() {
    List<LdifEntry> entries = parseAll(STRICT, "dn: cn=x\ncn:: Sm9o\n  bg==\ndescription:: SGVs bG8=\n");

    assertEquals("John", entries.get(0).attribute("cn").orElseThrow().toRecordValue());
    assertEquals("Hello", entries.get(0).attribute("description").orElseThrow().toRecordValue());
  }

  @Test
  void decodesBase64ValuesAndDn() {
    String dn = Base64.getEncoder().encodeToString("cn=Zoë,dc=example".getBytes(StandardCharsets.UTF_8));
    String cn = Base64.getEncoder().encodeToString("Zoë".getBytes(StandardCharsets.UTF_8));

    List<LdifEntry> entries = parseAll(STRICT, "dn:: " + dn + "\ncn:: " + cn + "\n");

    assertEquals("cn=Zoë,dc=example", entries.get(0).dn());
    assertEquals("Zoë", entries.get(0).attribute("cn").orElseThrow().toRecordValue());
  }

  @Test
  void binaryBase64PayloadIsKeptEncoded() {
    Logger logger = (Logger) LoggerFactory.getLogger(LdifStateMachine.class);
    Level originalLevel = logger.getLevel();
    ListAppender<ILoggingEvent> appender = new ListAppender<>();
    appender.start();
    logger.addAppender(appender);
    logger.setLevel(Level.DEBUG);
    try {
      List<LdifEntry> entries = parseAll(STRICT, "dn: cn=x\njpegPhoto:: /9g=\n");

      assertEquals("/9g=", entries.get(0).attribute("jpegphoto").orElseThrow().toRecordValue());
      assertTrue(appender.list.stream()
          .anyMatch(event -> event.getFormattedMessage().equals("Keeping binary value of jpegPhoto (2 bytes) base64-encoded")));
    } finally {
      logger.detachAppender(appender);
      appender.stop();
      logger.setLevel(originalLevel);
    }
  }

  @Test
  void invalidBase64IsDroppedInLenientMode() {
    try (LdifEntryReader reader = open(LENIENT, "dn: cn=x\ncn: x\nuserPassword:: !!!notbase64\n")) {
      LdifEntry entry = reader.next();

      assertTrue(entry.attribute("userpassword").isEmpty());
      assertEquals("x", entry.attribute("cn").orElseThrow().toRecordValue());
      assertFalse(reader.hasNext());
      assertEquals(1, reader.statistics().valuesDropped());
    }
  }

  @Test
  void invalidBase64AbortsInStrictMode() {
    LdifEntryReader reader = open(STRICT, "dn: cn=x\nuserPassword:: !!!notbase64\n");

    LdifParseException ex = assertThrows(LdifParseException.class, reader::hasNext);

    assertEquals(LdifIssue.Kind.INVALID_BASE64, ex.kind());
    assertEquals(2, ex.lineNumber());
  }

  @Test
  void repeatedAttributeBecomesOrderedList() {
    List<LdifEntry> entries = parseAll(STRICT, """
        dn: cn=x
        mail: a@example.com
        MAIL: b@example.com
        mail: c@example.com
        """);

    assertEquals(List.of("a@example.com", "b@example.com", "c@example.com"),
        entries.get(0).attribute("mail").orElseThrow().toRecordValue());
  }

  @Test
  void entriesAreSeparatedByDnLinesAndEndOfInput() {
    List<LdifEntry> entries = parseAll(STRICT, """
        version: 1

        # people
        dn: cn=a,dc=example
        cn: a
        dn: cn=b,dc=example
        # inline comment does not end the entry
        cn: b

        dn: cn=c,dc=example
        cn: c""");

    assertEquals(3, entries.size());
    assertEquals(List.of("cn=a,dc=example", "cn=b,dc=example", "cn=c,dc=example"),
        entries.stream().map(LdifEntry::dn).toList());
    assertEquals("b", entries.get(1).attribute("cn").orElseThrow().toRecordValue());
    assertEquals(4, entries.get(0).lineNumber());
    assertEquals(6, entries.get(1).lineNumber());
    assertEquals(10, entries.get(2).lineNumber());
  }

  @Test
  void objectClassFilterUsesOrSemanticsAndCountsFilteredEntries() {
    EntryFilterPolicy policy = new EntryFilterPolicy(
        Optional.empty(), Set.of("inetOrgPerson", "groupOfNames"), Optional.empty(), Set.of(), false, null, true);

    try (LdifEntryReader reader = open(policy, """
        dn: cn=p,dc=example
        objectClass: inetOrgPerson

        dn: cn=g,dc=example
        objectClass: groupOfNames

        dn: ou=x,dc=example
        objectClass: organizationalUnit
        """)) {
      List<String> dns = new ArrayList<>();
      reader.forEachRemaining(entry -> dns.add(entry.dn()));

      assertEquals(List.of("cn=p,dc=example", "cn=g,dc=example"), dns);
      assertEquals(1, reader.statistics().entriesFiltered());
    }
  }

  @Test
  void baseDnAndAttributeFiltersApply() {
    EntryFilterPolicy policy = new EntryFilterPolicy(
        Optional.of("ou=People,dc=example"),
        Set.of(),
        Optional.of(Set.of("cn", "mail", "objectClass")),
        Set.of("mail"),
        false,
        null,
        true);

    List<LdifEntry> entries = parseAll(policy, """
        dn: cn=a,ou=people,dc=example
        cn: a
        mail: a@example.com
        sn: A
        objectClass: person
        createTimestamp: 20240101000000Z

        dn: cn=b,ou=groups,dc=example
        cn: b
        """);

    assertEquals(1, entries.size());
    LdifEntry entry = entries.get(0);
    assertEquals(Set.of("cn", "objectclass"), entry.attributes().keySet());
    assertEquals(List.of("person"), entry.objectClass());
  }

  @Test
  void operationalAttributesAreSuppressedByDefault() {
    List<LdifEntry> entries = parseAll(STRICT, """
        dn: cn=a
        cn: a
        entryUUID: 1234
        modifiersName: cn=admin
        """);

    assertEquals(Set.of("cn"), entries.get(0).attributes().keySet());
  }

  @Test
  void unparseableLineIsSkippedInLenientMode() {
    try (LdifEntryReader reader = open(LENIENT, "dn: cn=x\ncn: x\nnot_an_attribute_line\nsn: y\n")) {
      LdifEntry entry = reader.next();

      assertEquals("x", entry.attribute("cn").orElseThrow().toRecordValue());
      assertEquals("y", entry.attribute("sn").orElseThrow().toRecordValue());
      assertEquals(1, reader.statistics().linesSkipped());
    }
  }

  @Test
  void unparseableLineAbortsInStrictModeBeforeEmittingEntry() {
    LdifEntryReader reader = open(STRICT, "dn: cn=x\ncn: x\nnot_an_attribute_line\n");

    LdifParseException ex = assertThrows(LdifParseException.class, reader::hasNext);

    assertEquals(LdifIssue.Kind.UNPARSEABLE_LINE, ex.kind());
    assertEquals(3, ex.lineNumber());
    assertEquals("test.ldif", ex.sourceFile());
    assertFalse(reader.hasNext());
  }

  @Test
  void entryWithBlankDnIsDropped() {
    try (LdifEntryReader reader = open(STRICT, "dn:   \ncn: x\n\ndn: cn=y\ncn: y\n")) {
      List<LdifEntry> entries = new ArrayList<>();
      reader.forEachRemaining(entries::add);

      assertEquals(1, entries.size());
      assertEquals("cn=y", entries.get(0).dn());
      assertEquals(1, reader.statistics().entriesWithoutDn());
    }
  }

  @Test
  void entryWithBase64UnicodeSpaceDnIsDropped() {
    // 4oCD is U+2003 EM SPACE
    try (LdifEntryReader reader = open(LENIENT, "dn:: 4oCD\ncn: x\ndn: cn=y\ncn: y\n")) {
      List<LdifEntry> entries = new ArrayList<>();
      reader.forEachRemaining(entries::add);

      assertEquals(1, entries.size());
      assertEquals("cn=y", entries.get(0).dn());
      assertEquals(1, reader.statistics().entriesWithoutDn());
    }
  }

  @Test
  void linesBeforeFirstDnAreIgnored() {
    List<LdifEntry> entries = parseAll(STRICT, "cn: orphan\n  continued\ndn: cn=x\ncn: x\n");

    assertEquals(1, entries.size());
    assertEquals("x", entries.get(0).attribute("cn").orElseThrow().toRecordValue());
  }

  @Test
  void attributeOptionsChangeTypeAndUrlValuesArePreserved() {
    List<LdifEntry> entries = parseAll(STRICT, """
        dn: cn=x
        changetype: modify
        replace: description
        description;lang-fr: Bonjour
        -
        jpegPhoto:< file:///tmp/photo.jpg \s
        """);

    LdifEntry entry = entries.get(0);
    assertEquals(Optional.of("modify"), entry.changeType());
    assertEquals("Bonjour", entry.attribute("description;lang-fr").orElseThrow().toRecordValue());
    assertEquals("file:///tmp/photo.jpg", entry.attribute("jpegphoto").orElseThrow().toRecordValue());
  }

  @Test
  void entrySizeCountsEncodedLinesWithTerminators() {
    List<LdifEntry> lf = parseAll(STRICT, "dn: cn=a\ncn: a\n\n# trailing comment\n");
    List<LdifEntry> crlf = parseAll(STRICT, "dn: cn=a\r\ncn: a\r\n\r\n");
    List<LdifEntry> multibyte = parseAll(STRICT, "dn: cn=é\n");

    assertEquals(15, lf.get(0).entrySize());
    assertEquals(17, crlf.get(0).entrySize());
    assertEquals(10, multibyte.get(0).entrySize());
  }

  @Test
  void crlfInputYieldsSameValuesAsLf() {
    List<LdifEntry> entries = parseAll(STRICT, "dn: cn=a\r\ndescription: Hello\r\n  World\r\n\r\ndn: cn=b\r\n");

    assertEquals(2, entries.size());
    assertEquals("Hello World", entries.get(0).attribute("description").orElseThrow().toRecordValue());
  }

  @Test
  void readerIsClosedWhenExhaustedAndOnFailure() {
    TrackingReader exhaustedSource = new TrackingReader("dn: cn=a\n");
    LdifEntryReader exhausted = new LdifParser(STRICT, StandardCharsets.UTF_8).parse("a.ldif", exhaustedSource);
    exhausted.next();
    assertFalse(exhausted.hasNext());
    assertTrue(exhaustedSource.closed);

    TrackingReader failingSource = new TrackingReader("dn: cn=a\ngarbage\n");
    LdifEntryReader failing = new LdifParser(STRICT, StandardCharsets.UTF_8).parse("b.ldif", failingSource);
    assertThrows(LdifParseException.class, failing::hasNext);
    assertTrue(failingSource.closed);
  }

  @Test
  void streamClosesReaderWhenClosedEarly() {
    TrackingReader source = new TrackingReader("dn: cn=a\n\ndn: cn=b\n\ndn: cn=c\n");
    LdifEntryReader reader = new LdifParser(STRICT, StandardCharsets.UTF_8).parse("s.ldif", source);

    try (var stream = reader.stream()) {
      assertEquals("cn=a", stream.findFirst().orElseThrow().dn());
    }

    assertTrue(source.closed);
    assertThrows(NoSuchElementException.class, reader::next);
  }

  @Test
  void openReadsFileWithByteOrderMark() throws IOException {
    Path file = tempDir.resolve("bom.ldif");
    Files.writeString(file, "\uFEFFdn: cn=a\ncn: a\n", StandardCharsets.UTF_8);

    try (LdifEntryReader reader = new LdifParser(STRICT, StandardCharsets.UTF_8).open(file)) {
      LdifEntry entry = reader.next();
      assertEquals("cn=a", entry.dn());
      assertEquals(file.toString(), entry.sourceFile());
      assertEquals(18, entry.entrySize());
    }
  }

  @Test
  void undecodableFileIsRejectedBeforeAnyEntryInLenientMode() throws IOException {
    Path file = tempDir.resolve("bad.ldif");
    byte[] head = "dn: cn=a\ncn: a\n\ndn: cn=b\ncn: ".getBytes(StandardCharsets.UTF_8);
    byte[] content = new byte[head.length + 2];
    System.arraycopy(head, 0, content, 0, head.length);
    content[head.length] = (byte) 0xC3;
    content[head.length + 1] = (byte) 0x28;
    Files.write(file, content);

    LdifParser parser = new LdifParser(LENIENT, StandardCharsets.UTF_8);
    LdifParseException ex = assertThrows(LdifParseException.class, () -> parser.open(file));

    assertEquals(LdifIssue.Kind.DECODE, ex.kind());
  }

  @Test
  void latin1EncodingIsHonoured() throws IOException {
    Path file = tempDir.resolve("latin1.ldif");
    Files.write(file, "dn: cn=Zoë\ncn: Zoë\n".getBytes(StandardCharsets.ISO_8859_1));

    try (LdifEntryReader reader = new LdifParser(STRICT, StandardCharsets.ISO_8859_1).open(file)) {
      LdifEntry entry = reader.next();
      assertEquals("cn=Zoë", entry.dn());
      assertEquals(19, entry.entrySize());
    }
  }

  private static List<LdifEntry> parseAll(EntryFilterPolicy policy, String ldif) {
    List<LdifEntry> entries = new ArrayList<>();
    try (LdifEntryReader reader = open(policy, ldif)) {
      reader.forEachRemaining(entries::add);
    }
    return entries;
  }

  private static LdifEntryReader open(EntryFilterPolicy policy, String ldif) {
    return new LdifParser(policy, StandardCharsets.UTF_8).parse("test.ldif", new StringReader(ldif));
  }

  private static final class TrackingReader extends StringReader {
    private boolean closed;

    TrackingReader(String content) {
      super(content);
    }

    @Override
    public void close() {
      closed = true;
      super.close();
    }
  }
}
