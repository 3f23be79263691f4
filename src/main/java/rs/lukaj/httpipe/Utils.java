package rs.lukaj.httpipe;


import java.util.List;

//you know, other stuff
public class Utils {
    private Utils() {
    }

    /**
     * Join byte arrays into one, in order.
     * @param chunks arrays to join
     * @return all bytes from all chunks
     */
    public static byte[] concat(List<byte[]> chunks) {
        int length = 0;
        for(byte[] chunk : chunks) length += chunk.length;
        byte[] joined = new byte[length];
        int pos = 0;
        for(byte[] chunk : chunks) {
            System.arraycopy(chunk, 0, joined, pos, chunk.length);
            pos += chunk.length;
        }
        return joined;
    }
}
