// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.multivault.core.script;

import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import java.io.IOException;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import org.bitcoinj.core.Address;
import org.bitcoinj.core.AddressFormatException;
import org.bitcoinj.core.Coin;
import org.bitcoinj.core.ECKey;
import org.bitcoinj.core.NetworkParameters;
import org.bitcoinj.core.ProtocolException;
import org.bitcoinj.core.SegwitAddress;
import org.bitcoinj.core.Sha256Hash;
import org.bitcoinj.core.SignatureDecodeException;
import org.bitcoinj.core.Transaction;
import org.bitcoinj.core.TransactionInput;
import org.bitcoinj.core.TransactionOutPoint;
import org.bitcoinj.core.TransactionWitness;
import org.bitcoinj.crypto.TransactionSignature;
import org.bitcoinj.script.Script;
import org.bitcoinj.script.ScriptBuilder;
import org.bitcoinj.script.ScriptException;
import org.jspecify.annotations.Nullable;
import sh.multivault.core.chain.BitcoinNetwork;
import sh.multivault.core.error.InvalidSignatureException;
import sh.multivault.core.error.ValidationException;
import sh.multivault.core.model.Utxo;
import sh.multivault.primitives.Hex;

/**
 * {@link ScriptEngine} backed by bitcoinj, producing native SegWit (P2WSH) multisig outputs.
 *
 * <p>
 * Signatures are accepted DER-encoded or as 64-byte compact {@code r || s}, with or without a
 * trailing {@code SIGHASH_ALL} byte. They are normalized to low-S before being stored.
 *
 * @since 0.1.0
 */
public final class BitcoinjScriptEngine implements ScriptEngine {

    private static final int COMPACT_SIGNATURE_LENGTH = 64;
    private static final int COMPRESSED_KEY_LENGTH = 33;
    private static final byte SIGHASH_ALL = 0x01;

    private final NetworkParameters params;
    private final ObjectMapper mapper;

    public BitcoinjScriptEngine(final BitcoinNetwork network) {
        this.params = Objects.requireNonNull(network, "network").params();
        this.mapper = JsonMapper.builder()
                .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
                .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
                .build();
    }

    @Override
    public MultisigScript deriveAddress(final int m, final List<String> publicKeys) {
        final Script witnessScript = witnessScript(m, publicKeys);
        final SegwitAddress address = SegwitAddress.fromHash(params, Sha256Hash.hash(witnessScript.getProgram()));
        return new MultisigScript(address.toBech32(), Hex.encodeNoPrefix(witnessScript.getProgram()));
    }

    @Override
    public TransactionTemplate newTemplate(final int m, final List<String> publicKeys) {
        return new P2wshTemplate(m, witnessScript(m, publicKeys), new Transaction(params));
    }

    @Override
    public void addInput(final TransactionTemplate template, final Utxo utxo) {
        final P2wshTemplate t = cast(template);
        final TransactionOutPoint outPoint = new TransactionOutPoint(params, utxo.vout(), Sha256Hash.wrap(utxo.txid()));
        t.tx().addInput(new TransactionInput(params, t.tx(), new byte[0], outPoint, Coin.valueOf(utxo.amount())));
        t.trackInput(utxo.amount());
    }

    @Override
    public void addOutput(final TransactionTemplate template, final String address, final long amount) {
        if (amount <= 0) {
            throw new ValidationException("Output amount must be positive: " + amount);
        }
        cast(template).tx().addOutput(Coin.valueOf(amount), parseAddress(address));
    }

    @Override
    public byte[] unsignedDigest(final TransactionTemplate template, final int inputIndex) {
        final P2wshTemplate t = cast(template);
        t.checkInputIndex(inputIndex);
        return digest(t, inputIndex);
    }

    @Override
    public void applySignature(
            final TransactionTemplate template, final int inputIndex, final String publicKey, final byte[] signature) {
        final P2wshTemplate t = cast(template);
        t.checkInputIndex(inputIndex);
        final String key = Hex.cleanPrefix(publicKey).toLowerCase();
        if (!t.publicKeys().contains(key)) {
            throw new InvalidSignatureException(inputIndex, "public key is not part of the wallet policy");
        }
        final byte[] digest = digest(t, inputIndex);
        final byte[] pubKey = Hex.decode(key);
        ECKey.ECDSASignature accepted = null;
        for (ECKey.ECDSASignature candidate : decodeSignature(inputIndex, signature)) {
            final ECKey.ECDSASignature canonical = candidate.toCanonicalised();
            if (ECKey.verify(digest, canonical, pubKey)) {
                accepted = canonical;
                break;
            }
        }
        if (accepted == null) {
            throw new InvalidSignatureException(inputIndex, "signature does not verify against the input digest");
        }
        t.signatures(inputIndex).put(
                key, new TransactionSignature(accepted, Transaction.SigHash.ALL, false).encodeToBitcoin());
    }

    @Override
    public byte[] finalizeTemplate(final TransactionTemplate template) {
        final P2wshTemplate t = cast(template);
        if (t.inputCount() == 0) {
            throw new IllegalStateException("Template has no inputs");
        }
        final Transaction signed = new Transaction(params, t.tx().bitcoinSerialize());
        final byte[] program = t.witnessScript().getProgram();
        for (int i = 0; i < t.inputCount(); i++) {
            final Map<String, byte[]> collected = t.signatures(i);
            final List<byte[]> ordered = new ArrayList<>();
            for (String key : t.publicKeys()) {
                final byte[] sig = collected.get(key);
                if (sig != null && ordered.size() < t.threshold()) {
                    ordered.add(sig);
                }
            }
            if (ordered.size() < t.threshold()) {
                throw new IllegalStateException(
                        "Input " + i + " has " + ordered.size() + " of " + t.threshold() + " signatures");
            }
            final TransactionWitness witness = new TransactionWitness(t.threshold() + 2);
            witness.setPush(0, new byte[0]);
            for (int s = 0; s < ordered.size(); s++) {
                witness.setPush(s + 1, ordered.get(s));
            }
            witness.setPush(t.threshold() + 1, program);
            signed.getInput(i).setWitness(witness);
        }
        return signed.bitcoinSerialize();
    }

    @Override
    public byte[] serialize(final TransactionTemplate template) {
        final P2wshTemplate t = cast(template);
        final List<TemplateSnapshot.InputSnapshot> inputs = new ArrayList<>();
        for (int i = 0; i < t.inputCount(); i++) {
            final Map<String, String> sigs = new TreeMap<>();
            t.signatures(i).forEach((key, sig) -> sigs.put(key, Hex.encodeNoPrefix(sig)));
            inputs.add(new TemplateSnapshot.InputSnapshot(t.inputValue(i), sigs));
        }
        final TemplateSnapshot snapshot = new TemplateSnapshot(
                TemplateSnapshot.CURRENT_FORMAT,
                params.getId(),
                t.threshold(),
                Hex.encodeNoPrefix(t.witnessScript().getProgram()),
                Hex.encodeNoPrefix(t.tx().bitcoinSerialize()),
                inputs);
        try {
            return mapper.writeValueAsBytes(snapshot);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to serialize transaction template", e);
        }
    }

    @Override
    public TransactionTemplate deserialize(final byte[] serialized) {
        final TemplateSnapshot snapshot;
        try {
            snapshot = mapper.readValue(serialized, TemplateSnapshot.class);
        } catch (IOException e) {
            throw new ValidationException("Malformed transaction template", e);
        }
        if (snapshot.format() != TemplateSnapshot.CURRENT_FORMAT) {
            throw new ValidationException("Unsupported template format " + snapshot.format());
        }
        if (!params.getId().equals(snapshot.network())) {
            throw new ValidationException("Template was built for network " + snapshot.network());
        }
        final P2wshTemplate t;
        try {
            final Script witnessScript = new Script(Hex.decode(snapshot.witnessScript()));
            t = new P2wshTemplate(
                    snapshot.threshold(), witnessScript, new Transaction(params, Hex.decode(snapshot.unsignedTx())));
        } catch (ProtocolException | ScriptException | IllegalArgumentException e) {
            throw new ValidationException("Malformed transaction template", e);
        }
        final List<TemplateSnapshot.InputSnapshot> inputs = snapshot.inputs() == null ? List.of() : snapshot.inputs();
        if (inputs.size() != t.tx().getInputs().size()) {
            throw new ValidationException("Template input metadata does not match its transaction");
        }
        for (int i = 0; i < inputs.size(); i++) {
            final TemplateSnapshot.InputSnapshot input = inputs.get(i);
            t.trackInput(input.value());
            if (input.partialSignatures() != null) {
                input.partialSignatures().forEach((key, sig) -> t.signatures(t.inputCount() - 1).put(key, Hex.decode(sig)));
            }
        }
        return t;
    }

    @Override
    public ScriptKind outputKind(final String address) {
        final Script.ScriptType type = parseAddress(address).getOutputScriptType();
        try {
            return ScriptKind.valueOf(type.name());
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Unsupported address type " + type + ": " + address, e);
        }
    }

    private Script witnessScript(final int m, final List<String> publicKeys) {
        Objects.requireNonNull(publicKeys, "publicKeys");
        if (m < 1 || m > publicKeys.size()) {
            throw new ValidationException("Invalid policy " + m + "-of-" + publicKeys.size());
        }
        final List<ECKey> keys = new ArrayList<>(publicKeys.size());
        for (String publicKey : publicKeys) {
            keys.add(parseKey(publicKey));
        }
        try {
            return ScriptBuilder.createMultiSigOutputScript(m, keys);
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Invalid policy " + m + "-of-" + publicKeys.size(), e);
        }
    }

    private static ECKey parseKey(final String publicKey) {
        if (publicKey == null || !Hex.isHex(publicKey)) {
            throw new ValidationException("Public key is not hex: " + publicKey);
        }
        final byte[] bytes = Hex.decode(publicKey);
        if (bytes.length != COMPRESSED_KEY_LENGTH || (bytes[0] != 0x02 && bytes[0] != 0x03)) {
            throw new ValidationException("Not a compressed public key: " + publicKey);
        }
        try {
            return ECKey.fromPublicOnly(bytes);
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Public key is not on the curve: " + publicKey, e);
        }
    }

    private Address parseAddress(final String address) {
        if (address == null || address.isBlank()) {
            throw new ValidationException("Address must not be blank");
        }
        try {
            return Address.fromString(params, address);
        } catch (AddressFormatException e) {
            throw new ValidationException("Invalid address for " + params.getId() + ": " + address, e);
        }
    }

    private static byte[] digest(final P2wshTemplate t, final int inputIndex) {
        return t.tx()
                .hashForWitnessSignature(
                        inputIndex, t.witnessScript(), Coin.valueOf(t.inputValue(inputIndex)), Transaction.SigHash.ALL, false)
                .getBytes();
    }

    /**
     * Possible readings of {@code signature}. A 64-byte compact signature can also be shaped
     * like DER, in which case both readings are returned and verification picks the right one.
     */
    private static List<ECKey.ECDSASignature> decodeSignature(final int inputIndex, final byte[] signature) {
        if (signature == null || signature.length < 2) {
            throw new InvalidSignatureException(inputIndex, "signature is empty");
        }
        final byte[] compact = compactBody(signature);
        final List<ECKey.ECDSASignature> candidates = new ArrayList<>(2);
        if (looksLikeDer(signature)) {
            try {
                candidates.add(decodeDer(inputIndex, signature));
            } catch (InvalidSignatureException e) {
                if (compact == null) {
                    throw e;
                }
            }
        }
        if (compact != null) {
            final BigInteger r = new BigInteger(1, Arrays.copyOfRange(compact, 0, 32));
            final BigInteger s = new BigInteger(1, Arrays.copyOfRange(compact, 32, 64));
            if (r.signum() != 0 && s.signum() != 0) {
                candidates.add(new ECKey.ECDSASignature(r, s));
            } else if (candidates.isEmpty()) {
                throw new InvalidSignatureException(inputIndex, "compact signature has a zero component");
            }
        }
        if (candidates.isEmpty()) {
            throw new InvalidSignatureException(inputIndex, "signature is neither DER nor compact");
        }
        return candidates;
    }

    /** The 64-byte {@code r || s} body, or null if the length rules out a compact signature. */
    private static byte @Nullable [] compactBody(final byte[] signature) {
        if (signature.length == COMPACT_SIGNATURE_LENGTH) {
            return signature;
        }
        if (signature.length == COMPACT_SIGNATURE_LENGTH + 1 && signature[COMPACT_SIGNATURE_LENGTH] == SIGHASH_ALL) {
            return Arrays.copyOf(signature, COMPACT_SIGNATURE_LENGTH);
        }
        return null;
    }

    private static boolean looksLikeDer(final byte[] bytes) {
        final int derLength = (bytes[1] & 0xff) + 2;
        return bytes[0] == 0x30 && (bytes.length == derLength || bytes.length == derLength + 1);
    }

    private static ECKey.ECDSASignature decodeDer(final int inputIndex, final byte[] signature) {
        final int derLength = (signature[1] & 0xff) + 2;
        byte[] bytes = signature;
        if (bytes.length == derLength + 1) {
            if (bytes[derLength] != SIGHASH_ALL) {
                throw new InvalidSignatureException(inputIndex, "only SIGHASH_ALL signatures are accepted");
            }
            bytes = Arrays.copyOf(bytes, derLength);
        }
        try {
            return ECKey.ECDSASignature.decodeFromDER(bytes);
        } catch (SignatureDecodeException | RuntimeException e) {
            throw new InvalidSignatureException(inputIndex, "signature is not valid DER", e);
        }
    }

    private static P2wshTemplate cast(final TransactionTemplate template) {
        if (template instanceof P2wshTemplate) {
            return (P2wshTemplate) template;
        }
        throw new IllegalArgumentException("Template was not created by this engine: " + template);
    }
}
