/*
 * This file is part of PrivateDAO.
 *
 * PrivateDAO is free software: you can redistribute it and/or modify it
 * under the terms of the GNU Affero General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or (at
 * your option) any later version.
 *
 * PrivateDAO is distributed in the hope that it will be useful, but WITHOUT
 * ANY WARRANTY; without even the implied warranty of MERCHANTABILITY or
 * FITNESS FOR A PARTICULAR PURPOSE. See the GNU Affero General Public
 * License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with PrivateDAO. If not, see <http://www.gnu.org/licenses/>.
 */

package privatedao.core.dao.vote.myvote;

import privatedao.core.dao.DaoOptionKeys;
import privatedao.core.dao.identity.Address;

import org.bitcoinj.core.Utils;

import org.apache.commons.lang3.StringUtils;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonDeserializationContext;
import com.google.gson.JsonDeserializer;
import com.google.gson.JsonElement;
import com.google.gson.JsonParseException;
import com.google.gson.JsonPrimitive;
import com.google.gson.JsonSerializationContext;
import com.google.gson.JsonSerializer;
import com.google.gson.reflect.TypeToken;

import javax.inject.Inject;
import javax.inject.Named;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.io.Writer;

import java.lang.reflect.Type;

import java.util.ArrayList;
import java.util.List;

import lombok.extern.slf4j.Slf4j;

import javax.annotation.Nullable;

/**
 * Keeps the voter's secrets as JSON in the storage directory. Without a directory the votes live in memory only.
 */
@Slf4j
public class MyVoteStorage {
    static final String FILE_NAME = "MyVotes.json";

    private static final Type LIST_TYPE = new TypeToken<List<MyVote>>() {
    }.getType();

    private final Gson gson;
    @Nullable
    private final Path storageFile;

    @Inject
    public MyVoteStorage(@Named(DaoOptionKeys.MY_VOTE_STORAGE_DIR) String storageDir) {
        this.storageFile = StringUtils.isBlank(storageDir) ? null : Paths.get(storageDir, FILE_NAME);
        this.gson = new GsonBuilder()
                .registerTypeAdapter(Address.class, new AddressAdapter())
                .registerTypeAdapter(byte[].class, new HexAdapter())
                .setPrettyPrinting()
                .create();
    }

    public List<MyVote> load() {
        if (storageFile == null || !Files.exists(storageFile))
            return new ArrayList<>();

        try (Reader reader = Files.newBufferedReader(storageFile, StandardCharsets.UTF_8)) {
            List<MyVote> myVotes = gson.fromJson(reader, LIST_TYPE);
            log.info("Loaded {} votes from {}", myVotes != null ? myVotes.size() : 0, storageFile);
            return myVotes != null ? new ArrayList<>(myVotes) : new ArrayList<>();
        } catch (IOException e) {
            log.error("Could not read {}", storageFile, e);
            throw new UncheckedIOException(e);
        } catch (JsonParseException e) {
            log.error("Corrupted vote storage {}", storageFile, e);
            throw e;
        }
    }

    /**
     * Writes to a temporary file first and moves it over the old one, so a crash never leaves a partial file.
     */
    public void persist(List<MyVote> myVotes) throws IOException {
        if (storageFile == null)
            return;

        Files.createDirectories(storageFile.getParent());
        Path tempFile = storageFile.resolveSibling(FILE_NAME + ".tmp");
        try (Writer writer = Files.newBufferedWriter(tempFile, StandardCharsets.UTF_8)) {
            gson.toJson(myVotes, LIST_TYPE, writer);
        }
        Files.move(tempFile, storageFile, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    }

    private static class AddressAdapter implements JsonSerializer<Address>, JsonDeserializer<Address> {
        @Override
        public JsonElement serialize(Address address, Type type, JsonSerializationContext context) {
            return new JsonPrimitive(address.toBase58());
        }

        @Override
        public Address deserialize(JsonElement json, Type type, JsonDeserializationContext context) {
            return Address.fromBase58(json.getAsString());
        }
    }

    private static class HexAdapter implements JsonSerializer<byte[]>, JsonDeserializer<byte[]> {
        @Override
        public JsonElement serialize(byte[] bytes, Type type, JsonSerializationContext context) {
            return new JsonPrimitive(Utils.HEX.encode(bytes));
        }

        @Override
        public byte[] deserialize(JsonElement json, Type type, JsonDeserializationContext context) {
            return Utils.HEX.decode(json.getAsString());
        }
    }
}
