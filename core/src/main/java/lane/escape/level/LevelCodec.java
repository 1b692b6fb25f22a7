package lane.escape.level;

import com.esotericsoftware.kryo.Kryo;
import com.esotericsoftware.kryo.KryoException;
import com.esotericsoftware.kryo.io.Input;
import com.esotericsoftware.kryo.io.Output;
import com.esotericsoftware.minlog.Log;
import lane.escape.analysis.DirectionStats;
import lane.escape.board.Piece;
import lane.escape.board.enums.Axis;
import lane.escape.board.enums.Direction;
import lane.escape.board.enums.LayoutProfileType;
import lane.escape.board.enums.PieceType;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.FileInputStream;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;

/**
 * Binary form of {@link GenerationResult}, used to hand boards between threads and to export
 * them from the tools launcher. Runtime overlay fields are not written.
 * <p>
 * Registration order defines the wire format; append new classes at the end.
 */
public class LevelCodec {
    private static final int BUFFER_SIZE = 4096;

    private final Kryo kryo;

    public LevelCodec() {
        kryo = new Kryo();
        kryo.setRegistrationRequired(true);
        kryo.setReferences(false);

        kryo.register(int[].class);
        kryo.register(float[].class);
        kryo.register(ArrayList.class);

        kryo.register(Direction.class);
        kryo.register(Axis.class);
        kryo.register(PieceType.class);
        kryo.register(LayoutProfileType.class);

        kryo.register(Piece.class);
        kryo.register(DirectionStats.class);
        kryo.register(GenerationDiagnostics.class);
        kryo.register(GenerationResult.class);
    }

    public synchronized byte[] encode(GenerationResult result) {
        try (ByteArrayOutputStream bytes = new ByteArrayOutputStream();
             Output output = new Output(bytes, BUFFER_SIZE)) {
            kryo.writeObject(output, result);
            output.flush();
            return bytes.toByteArray();
        } catch (IOException e) {
            // ByteArrayOutputStream does not throw
            throw new KryoException(e);
        }
    }

    public synchronized GenerationResult decode(byte[] data) {
        try (Input input = new Input(data)) {
            return kryo.readObject(input, GenerationResult.class);
        }
    }

    public void write(GenerationResult result, File file) throws IOException {
        File parent = file.getAbsoluteFile().getParentFile();
        if (parent != null && !parent.exists() && !parent.mkdirs()) {
            throw new IOException("Could not create directory " + parent);
        }
        byte[] data = encode(result);
        try (FileOutputStream out = new FileOutputStream(file)) {
            out.write(data);
        }
        Log.debug("LevelCodec", "Wrote level " + result.level + " to " + file + " (" + data.length + " bytes)");
    }

    public GenerationResult read(File file) throws IOException {
        try (InputStream in = new FileInputStream(file)) {
            return decode(in.readAllBytes());
        } catch (KryoException e) {
            throw new IOException("Corrupt level file " + file + ": " + e.getMessage(), e);
        }
    }
}
