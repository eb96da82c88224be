/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.ackl.cli.ackl;


import java.io.Closeable;
import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.concurrent.Callable;

import io.crums.ackl.ByteEncoding;
import io.crums.ackl.CanonicalEncoder;
import io.crums.ackl.InvalidKeyMaterialException;
import io.crums.ackl.KeyCustodian;
import io.crums.ackl.LedgerConstants;
import io.crums.ackl.LedgerException;
import io.crums.ackl.SignatureRecord;
import io.crums.ackl.json.RecordParser;
import io.crums.ackl.json.ReportParser;
import io.crums.ackl.sql.DbSession;
import io.crums.ackl.sql.SqlLedgerException;
import io.crums.ackl.sql.SqlLedgerStore;
import io.crums.ackl.sql.config.LedgerConfig;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Help.Ansi;
import picocli.CommandLine.HelpCommand;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * Manages and audits an acknowledgment ledger.
 */
@Command(
    name = "ackl",
    mixinStandardHelpOptions = true,
    version = "ackl 0.1",
    synopsisHeading = "",
    customSynopsis = {
        "",
        "Acknowledgment ledger management and audit tool.",
        "",
        "Usage: @|bold ackl|@ @|fg(yellow) FILE|@ COMMAND",
        "       @|bold ackl help|@ COMMAND",
        "       @|bold ackl " + Keygen.NAME + "|@",
        "       @|bold ackl|@ [@|fg(yellow) -hV|@]",
        "",
    },
    subcommands = {
        HelpCommand.class,
        Keygen.class,
        Pubkey.class,
        Create.class,
        Status.class,
        ListCmd.class,
        Verify.class,
    })
public class Ackl implements Closeable {


  public static void main(String[] args) {
    int exitCode;

    try (var ackl = new Ackl()) {

      exitCode = newCommandLine(ackl).execute(args);

    } catch (Exception x) {
      if (Thread.interrupted())
        exitCode = INTERRUPT;
      else {
        System.err.printf("Unhandled exception: %s%n", x.toString());
        x.printStackTrace();
        exitCode = ERR_SOFT;
      }
    }

    System.exit(exitCode);
  }


  /**
   * Returns a command line for the given instance. Ledger errors are
   * reported (in red) without a stack trace, and mapped to exit codes.
   */
  static CommandLine newCommandLine(Ackl ackl) {
    var commandLine = new CommandLine(ackl);
    commandLine.setExecutionExceptionHandler(
        (x, cl, parseResult) -> {
          if (x instanceof SqlLedgerException) {
            ackl.printfError("[ERROR] database: %s", x.getMessage());
            return ERR_IO;
          }
          if (x instanceof LedgerException ||
              x instanceof IllegalArgumentException ||
              x instanceof IllegalStateException) {
            ackl.printfError("[ERROR] %s", x.getMessage());
            return ERR_USER;
          }
          throw x;
        });
    return commandLine;
  }


  final static int ERR_SOFT = 1;
  final static int ERR_USER = 2;
  final static int INTERRUPT = 3;
  final static int ERR_IO = 4;



  @Spec
  private CommandSpec spec;


  private File configFile;

  @Parameters(
      arity = "0..1",
      paramLabel = "FILE",
      description = {
          "Ledger configuration file (properties)",
          "@|bold Required|@ with any command except @|bold " + Keygen.NAME + "|@ and @|bold help|@"
      })
  public void setConfig(File configFile) {
    this.configFile = configFile;
    if (!configFile.isFile())
      throw new ParameterException(spec.commandLine(), "not a file: " + configFile);
    else if (!configFile.canRead())
      throw new ParameterException(spec.commandLine(), "need read permission: " + configFile);
  }


  /** Returns the configuration file, or {@code null} if not set. */
  public File getConfigFile() {
    return configFile;
  }


  /** Throws a {@linkplain ParameterException} if the config file is not set. */
  void requireConfig(CommandSpec cmdSpec) {
    if (configFile == null)
      throw new ParameterException(
          cmdSpec.commandLine(),
          "configuration FILE required for command " + cmdSpec.name());
  }



  private LedgerConfig config;


  public LedgerConfig getConfig() {
    if (config == null)
      config = new LedgerConfig(getConfigFile());
    return config;
  }



  private DbSession session;
  private SqlLedgerStore store;


  /**
   * Returns the ledger store. Opened read-only, unless {@linkplain #createLedger()}
   * was invoked first.
   */
  public SqlLedgerStore getStore() {
    if (store == null) {
      session = DbSession.newInstance(getConfig(), true);
      store = session.openLedger(getConfig().getSchema());
    }
    return store;
  }


  public void createLedger() {
    if (store != null)
      throw new IllegalStateException("cannot recreate already loaded ledger");
    session = DbSession.newInstance(getConfig(), false);
    store = session.declareLedger(getConfig().getSchema());
  }


  /** Closes the backing database connection. */
  @Override
  public void close() {
    if (session != null) {
      session.close();
      session = null;
      store = null;
    }
    config = null;
  }


  /**
   * Invokes {@code System.out.printf(format, args)} after pre-processing
   * any Jansi-encoded strings.
   *
   * @param format
   * @param args Jansi-encoded string arguments are pre-processed
   *
   * @see Ansi#string(String)
   * @see Ansi#AUTO
   */
  public void printf(String format, Object... args) {
    System.out.printf(format, jansify(args));
  }


  private Object[] jansify(Object[] args) {
    for (int index = args.length; index-- > 0; ) {
      if (args[index] instanceof String arg)
        args[index] = Ansi.AUTO.string(arg);
    }
    return args;
  }


  /**
   * Prints a line of error message in red.
   *
   * @param format
   * @param args this <em>might</em> also work with Jansi-encoded arguments
   */
  public void printfError(String format, Object... args) {
    var formatted = format.formatted(jansify(args));
    var inRed = Ansi.AUTO.string("@|red " + formatted + "|@");
    System.err.println(inRed);
  }

}


@Command(
    name = Keygen.NAME,
    description = {
        "Generate a new Ed25519 signing key",
        "Prints the base64 secret (seed followed by public key) and its public key.",
        "The secret is printed only if no output file is given.",
    })
class Keygen implements Runnable {

  final static String NAME = "keygen";

  @Spec
  private CommandSpec spec;

  @Option(
      names = {"-o", "--out"},
      paramLabel = "KEY_FILE",
      description = {
          "Write the secret to this (new) file instead of the console",
          "Reference it in the config FILE with @|bold " + LedgerConfig.SIGNING_KEY_FILE + "|@"
      })
  private File keyFile;


  @Override
  public void run() {
    var custodian = KeyCustodian.generate();
    var out = System.out;
    if (keyFile == null) {
      out.printf("secret:     %s%n", custodian.exportSecret());
    } else {
      if (keyFile.exists())
        throw new ParameterException(spec.commandLine(), "file already exists: " + keyFile);
      try {
        Files.writeString(
            keyFile.toPath(),
            custodian.exportSecret() + System.lineSeparator(),
            StandardCharsets.US_ASCII,
            StandardOpenOption.CREATE_NEW);
      } catch (IOException iox) {
        throw new ParameterException(
            spec.commandLine(), "failed to write " + keyFile + ": " + iox.getMessage(), iox);
      }
      out.printf("secret written to %s%n", keyFile);
    }
    out.printf("public key: %s%n", custodian.publicKeyBase64());
  }

}


@Command(
    name = Pubkey.NAME,
    description = "Print the configured public key (base64)")
class Pubkey implements Callable<Integer> {

  final static String NAME = "pubkey";

  @ParentCommand
  private Ackl ackl;

  @Spec
  private CommandSpec spec;

  @Override
  public Integer call() throws InvalidKeyMaterialException {
    ackl.requireConfig(spec);
    var config = ackl.getConfig();
    if (!config.hasKey()) {
      ackl.printfError(
          "[ERROR] no key configured (set %s, %s, %s, or %s)",
          LedgerConfig.SIGNING_KEY, LedgerConfig.SIGNING_KEY_FILE,
          LedgerConfig.VERIFY_KEY, LedgerConstants.KEY_ENV_VAR);
      return Ackl.ERR_USER;
    }
    var custodian = config.getKeyCustodian();
    ackl.printf(
        "%s%s%n",
        custodian.publicKeyBase64(),
        custodian.canSign() ? "" : "  (verify-only)");
    return 0;
  }

}


@Command(
    name = Create.NAME,
    description = {
        "Create the empty ledger table (and its write-once trigger)",
        "(as defined in the preceding config @|yellow FILE|@ argument)"})
class Create implements Runnable {

  final static String NAME = "create";

  @ParentCommand
  private Ackl ackl;

  @Spec
  private CommandSpec spec;

  @Override
  public void run() {
    ackl.requireConfig(spec);
    final var out = System.out;
    var schema = ackl.getConfig().getSchema();
    out.printf("%ncreating ledger table %s (%s)%n", schema.getTable(), schema.getDialect());
    ackl.createLedger();
    out.printf("%nDone.%n");
  }

}


@Command(
    name = Status.NAME,
    description = "Display ledger status: size, and the tail record")
class Status implements Runnable {

  final static String NAME = "status";

  @ParentCommand
  private Ackl ackl;

  @Spec
  private CommandSpec spec;

  @Override
  public void run() {
    ackl.requireConfig(spec);
    var store = ackl.getStore();
    var out = System.out;
    long size = store.size();
    out.printf("%n%d record%s in ledger%n", size, size == 1 ? "" : "s");
    var tail = store.tail();
    if (tail.isEmpty()) {
      out.println();
      return;
    }
    SignatureRecord record = tail.get();
    out.printf("%ntail id:       %d%n", record.id());
    out.printf("tail hash:     %s%n", ByteEncoding.BASE64.encode(record.payloadHash()));
    out.printf("tail created:  %s%n", CanonicalEncoder.formatTimestamp(record.createdAt()));
    ackl.printf(
        "%nUse the %s command to check the chain.%n%n", "@|bold " + Verify.NAME + "|@");
  }

}


@Command(
    name = ListCmd.NAME,
    description = {
        "List records as JSON (one per line)",
        "By id range, by subject, or by signer.",
        "",
    })
class ListCmd implements Runnable {

  final static String NAME = "list";

  @ParentCommand
  private Ackl ackl;

  @Spec
  private CommandSpec spec;


  private IdRange range;

  @Parameters(
      arity = "0..1",
      paramLabel = "IDS",
      description = {
          "Record id or id range. For example: 7, 20-40, or 100- (to the tail)",
          "Default: all records (unless @|bold --subject|@ or @|bold --signer|@ is given)"
      })
  public void setRange(String ids) {
    try {
      this.range = IdRange.parse(ids);
    } catch (IllegalArgumentException iax) {
      throw new ParameterException(spec.commandLine(), iax.getMessage());
    }
  }

  @Option(
      names = "--subject",
      paramLabel = "ID",
      description = "List the given subject's records (newest first)")
  private String subjectId;

  @Option(
      names = "--signer",
      paramLabel = "ID",
      description = "List the given signer's records (newest first)")
  private String signerId;


  @Override
  public void run() {
    ackl.requireConfig(spec);
    int selectors = (range == null ? 0 : 1) + (subjectId == null ? 0 : 1) + (signerId == null ? 0 : 1);
    if (selectors > 1)
      throw new ParameterException(
          spec.commandLine(), "only one of IDS, --subject, --signer may be given");

    var store = ackl.getStore();
    List<SignatureRecord> records;
    if (subjectId != null)
      records = store.listBySubject(subjectId);
    else if (signerId != null)
      records = store.listBySigner(signerId);
    else {
      var ids = range == null ? IdRange.ALL : range;
      long toId = Math.min(ids.toId(), store.size());
      records = toId < ids.fromId() ? List.of() : store.range(ids.fromId(), toId);
    }

    var out = System.out;
    for (var record : records)
      out.println(RecordParser.INSTANCE.toJsonObject(record).toJSONString());
  }

}


@Command(
    name = Verify.NAME,
    description = {
        "Replay the hash chain and check signatures",
        "Prints the JSON verification report.",
        "Exit code is 0 if no discrepancies were found; 1, otherwise.",
    })
class Verify implements Callable<Integer> {

  final static String NAME = "verify";

  @ParentCommand
  private Ackl ackl;

  @Spec
  private CommandSpec spec;


  private IdRange range = IdRange.ALL;

  @Parameters(
      arity = "0..1",
      paramLabel = "IDS",
      description = {
          "Record id or id range. For example: 7, 20-40, or 100- (to the tail)",
          "Default: the whole ledger"
      })
  public void setRange(String ids) {
    try {
      this.range = IdRange.parse(ids);
    } catch (IllegalArgumentException iax) {
      throw new ParameterException(spec.commandLine(), iax.getMessage());
    }
  }


  @Override
  public Integer call() {
    ackl.requireConfig(spec);
    var verifier = ackl.getConfig().getChainVerifier();
    var store = ackl.getStore();

    var report = store.verifyChain(verifier, range.fromId(), range.toId());
    System.out.println(ReportParser.INSTANCE.toJsonObject(report).toJSONString());

    if (report.isClean())
      return 0;

    ackl.printfError(
        "%d discrepanc%s found in %d records; first at id %d",
        report.discrepancies().size(),
        report.discrepancies().size() == 1 ? "y" : "ies",
        report.recordsChecked(),
        report.firstFailedId());
    return Ackl.ERR_SOFT;
  }

}
