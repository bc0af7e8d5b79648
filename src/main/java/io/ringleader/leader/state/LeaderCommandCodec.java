package io.ringleader.leader.state;

import io.ringleader.error.LeaderException;
import lombok.experimental.UtilityClass;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;

@UtilityClass
public final class LeaderCommandCodec {
    private static final byte FORMAT_VERSION = 1;
    private static final byte TAG_JOIN = 0;

    public byte[] encode(final LeaderCommand command) {
        final ByteArrayOutputStream bytes = new ByteArrayOutputStream(32);
        try (final DataOutputStream out = new DataOutputStream(bytes)) {
            out.writeByte(FORMAT_VERSION);
            if (command instanceof LeaderCommand.Join join) {
                out.writeByte(TAG_JOIN);
                out.writeUTF(join.lockKey());
            } else {
                throw new IllegalArgumentException("Unknown leader command " + command);
            }
        } catch (final IOException ioe) {
            throw new UncheckedIOException(ioe);
        }
        return bytes.toByteArray();
    }

    public LeaderCommand decode(final byte[] raw) {
        try (final DataInputStream in = new DataInputStream(new ByteArrayInputStream(raw))) {
            final byte version = in.readByte();
            if (version != FORMAT_VERSION) throw new IOException("unsupported format version " + version);
            final byte tag = in.readByte();
            if (tag != TAG_JOIN) throw new IOException("unknown command tag " + tag);
            final LeaderCommand cmd = new LeaderCommand.Join(in.readUTF());
            if (in.available() > 0) throw new IOException("trailing bytes");
            return cmd;
        } catch (final IOException e) {
            throw new LeaderException(LeaderException.Kind.CORRUPTED_STATE, "undecodable leader command", e);
        }
    }
}
