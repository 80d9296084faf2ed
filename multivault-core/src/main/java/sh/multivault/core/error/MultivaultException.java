// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.multivault.core.error;

/**
 * Base runtime exception for all Multivault failures.
 *
 * <p>
 * Every failure carries an {@link ErrorKind} plus a human-readable message so the host
 * application can render a response without inspecting the concrete type.
 *
 * <p>
 * <strong>Exception Hierarchy:</strong>
 * <pre>
 * MultivaultException
 * ├── {@link ValidationException} - bad shape or bounds of caller input
 * ├── {@link NotFoundException} - unknown wallet or transaction id
 * ├── {@link StateException} - operation illegal in the current lifecycle state
 * ├── {@link DuplicateSignerException} - public key already signed the transaction
 * ├── {@link InvalidSignatureException} - signature rejected by the script engine
 * ├── {@link FundsException}
 * │   ├── {@link InsufficientFundsException} - inputs do not cover amount plus fee
 * │   └── {@link NoFundsException} - no spendable outputs at the wallet address
 * ├── {@link ConflictException} - record with the derived id already exists
 * └── {@link ExternalServiceException} - network, signing or broadcast collaborator failure
 * </pre>
 *
 * <pre>{@code
 * try {
 *     engine.submitSignature(txId, publicKey, signatures);
 * } catch (DuplicateSignerException e) {
 *     // signer already counted
 * } catch (MultivaultException e) {
 *     respond(e.kind(), e.getMessage());
 * }
 * }</pre>
 *
 * @since 0.1.0
 */
public sealed class MultivaultException extends RuntimeException
        permits ValidationException,
        NotFoundException,
        StateException,
        DuplicateSignerException,
        InvalidSignatureException,
        FundsException,
        ConflictException,
        ExternalServiceException {

    private final ErrorKind kind;

    public MultivaultException(final ErrorKind kind, final String message) {
        super(message);
        this.kind = kind;
    }

    public MultivaultException(final ErrorKind kind, final String message, final Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind kind() {
        return kind;
    }
}
